package com.watchtide.repository;

import com.watchtide.model.WatchChannel;
import com.watchtide.model.WatchProvider;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Durable channel registry.
 *
 * findByProviderAndResourceKey(CALENDAR, "primary")
 * → SELECT * FROM watch_channels WHERE provider = ? AND resource_key = ?
 */
public interface WatchChannelRepository extends JpaRepository<WatchChannel, String> {

    Optional<WatchChannel> findByProviderAndResourceKey(WatchProvider provider, String resourceKey);

    List<WatchChannel> findAllByOrderByExpirationAsc();
}
