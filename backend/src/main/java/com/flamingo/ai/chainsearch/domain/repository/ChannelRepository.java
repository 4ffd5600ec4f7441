package com.flamingo.ai.chainsearch.domain.repository;

import com.flamingo.ai.chainsearch.domain.entity.Channel;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Channel entities. */
@Repository
public interface ChannelRepository extends JpaRepository<Channel, UUID> {}
