package com.watchtide.service;

import com.watchtide.client.SubscriptionApiException;
import com.watchtide.client.SubscriptionClient;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.ChannelStats;
import com.watchtide.dto.WatchRegistration;
import com.watchtide.dto.WatchRequest;
import com.watchtide.model.ChannelState;
import com.watchtide.model.WatchChannel;
import com.watchtide.model.WatchProvider;
import com.watchtide.model.WatchResource;
import com.watchtide.repository.WatchChannelRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Owns every watch channel: creation, renewal ahead of expiry, self-healing
 * and shutdown.
 *
 * STATES:
 *   PENDING_CREATE → ACTIVE → RENEWING → (replacement ACTIVE | EXPIRED) → STOPPED
 *
 * RENEWAL:
 *   createWatchChannel schedules renewChannel at (expiration − renewalAdvance)
 *   on the TaskScheduler. A failed renewal schedules another attempt after
 *   renewalRetryBackoff; there is no give-up path. The periodic health sweep
 *   catches anything the timers missed (restart, clock jump, lost timer).
 *
 * Remote stop failures are logged and never block local cleanup.
 */
@Service
@Slf4j
public class ChannelLifecycleManager implements ChannelRegistry {

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int MAX_RESOURCE_KEY_IN_ID = 24;

    private final WatchChannelRepository repository;
    private final Map<WatchProvider, SubscriptionClient> clients = new EnumMap<>(WatchProvider.class);
    private final TaskScheduler taskScheduler;
    private final WatchtideProperties properties;
    private final Clock clock;

    private final Map<WatchResource, ScheduledFuture<?>> renewalTimers = new ConcurrentHashMap<>();
    private final Map<WatchResource, ScheduledFuture<?>> retryTimers = new ConcurrentHashMap<>();
    private final Set<WatchResource> renewing = ConcurrentHashMap.newKeySet();
    private final SecureRandom random = new SecureRandom();

    public ChannelLifecycleManager(WatchChannelRepository repository,
                                   List<SubscriptionClient> subscriptionClients,
                                   TaskScheduler taskScheduler,
                                   WatchtideProperties properties,
                                   Clock clock) {
        this.repository = repository;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
        for (SubscriptionClient client : subscriptionClients) {
            clients.put(client.provider(), client);
        }
    }

    @Override
    public Optional<WatchChannel> findChannel(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        return repository.findById(channelId);
    }

    public WatchChannel getChannel(String channelId) {
        return findChannel(channelId).orElseThrow(() -> new ChannelNotFoundException(channelId));
    }

    public List<WatchChannel> listChannels() {
        return repository.findAllByOrderByExpirationAsc();
    }

    public SubscriptionClient clientFor(WatchProvider provider) {
        SubscriptionClient client = clients.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No subscription client for provider " + provider);
        }
        return client;
    }

    public List<WatchResource> configuredResources() {
        List<WatchResource> resources = new ArrayList<>();
        properties.getChannels().getCalendarIds().forEach(id -> resources.add(WatchResource.calendar(id)));
        properties.getChannels().getGmailAddresses().forEach(email -> resources.add(WatchResource.gmail(email)));
        return resources;
    }

    /**
     * Returns the resource's live channel, creating one if there is none.
     */
    public WatchChannel ensureWatched(WatchResource resource) {
        Optional<WatchChannel> existing = repository.findByProviderAndResourceKey(
                resource.getProvider(), resource.getResourceKey());
        if (existing.isPresent() && existing.get().isLiveAt(clock.instant())) {
            log.debug("Resource already watched: resource={}, channelId={}", resource, existing.get().getId());
            return existing.get();
        }
        return createWatchChannel(resource);
    }

    /**
     * Opens a new channel for the resource and arms its renewal timer. Any
     * channel already tracked for the resource is stopped and replaced.
     *
     * @throws SubscriptionApiException if the provider refuses the watch; no
     *         local state is left behind in that case
     */
    public WatchChannel createWatchChannel(WatchResource resource) {
        String carriedCheckpoint = repository.findByProviderAndResourceKey(
                        resource.getProvider(), resource.getResourceKey())
                .map(this::retire)
                .orElse(null);
        return openChannel(resource, carriedCheckpoint);
    }

    /**
     * Replaces the resource's channel: best-effort stop of the old one, then
     * a fresh create. On failure another attempt is scheduled after the
     * retry backoff.
     *
     * @return true if a replacement channel is now active
     */
    public boolean renewChannel(WatchResource resource) {
        if (!renewing.add(resource)) {
            log.debug("Renewal already in progress: resource={}", resource);
            return false;
        }
        try {
            String carriedCheckpoint = repository.findByProviderAndResourceKey(
                            resource.getProvider(), resource.getResourceKey())
                    .map(channel -> {
                        channel.setState(ChannelState.RENEWING);
                        channel.setUpdatedAt(clock.instant());
                        return retire(repository.save(channel));
                    })
                    .orElse(null);
            WatchChannel replacement = openChannel(resource, carriedCheckpoint);
            log.info("Watch channel renewed: resource={}, channelId={}, expiration={}",
                    resource, replacement.getId(), replacement.getExpiration());
            return true;
        } catch (RuntimeException e) {
            Duration backoff = properties.getChannels().getRenewalRetryBackoff();
            log.error("Renewal failed, retrying in {}: resource={}, error={}", backoff, resource, e.getMessage(), e);
            scheduleRetry(resource);
            return false;
        } finally {
            renewing.remove(resource);
        }
    }

    public boolean renewChannel(WatchChannel channel) {
        return renewChannel(channel.resource());
    }

    public int renewAll() {
        int renewed = 0;
        for (WatchChannel channel : repository.findAll()) {
            if (renewChannel(channel.resource())) {
                renewed++;
            }
        }
        return renewed;
    }

    /**
     * Periodic self-healing pass:
     *   not live       → drop locally, re-create now (expired, or a row
     *                    stranded in PENDING_CREATE by a crash mid-create)
     *   expiring soon  → renew now
     *   configured but not tracked → create
     * Resources with a renewal in flight or a retry pending are left alone.
     */
    @Scheduled(fixedDelayString = "#{@watchtideProperties.channels.healthCheckInterval.toMillis()}",
               initialDelayString = "#{@watchtideProperties.channels.healthCheckInterval.toMillis()}")
    public void healthSweep() {
        Instant now = clock.instant();
        Instant renewalHorizon = now.plus(properties.getChannels().getRenewalAdvance());
        Set<WatchResource> tracked = new HashSet<>();

        for (WatchChannel channel : repository.findAll()) {
            WatchResource resource = channel.resource();
            tracked.add(resource);
            if (isBusy(resource)) {
                continue;
            }
            if (!channel.isLiveAt(now)) {
                log.warn("Watch channel not live, re-creating: resource={}, channelId={}, state={}, expiration={}",
                        resource, channel.getId(), channel.getState(), channel.getExpiration());
                cancelRenewalTimer(resource);
                repository.delete(channel);
                try {
                    openChannel(resource, channel.getCheckpoint());
                } catch (RuntimeException e) {
                    log.error("Re-create of channel failed: resource={}, error={}", resource, e.getMessage());
                    scheduleRetry(resource);
                }
            } else if (!channel.getExpiration().isAfter(renewalHorizon)) {
                log.info("Watch channel expiring soon, renewing: resource={}, expiration={}",
                        resource, channel.getExpiration());
                renewChannel(resource);
            }
        }

        for (WatchResource resource : configuredResources()) {
            if (tracked.contains(resource) || isBusy(resource)) {
                continue;
            }
            log.warn("Configured resource has no watch channel, creating: resource={}", resource);
            try {
                openChannel(resource, null);
            } catch (RuntimeException e) {
                log.error("Create for configured resource failed: resource={}, error={}", resource, e.getMessage());
                scheduleRetry(resource);
            }
        }
    }

    /**
     * Re-arms renewal timers for channels persisted by an earlier run.
     */
    public int restoreRenewalTimers() {
        int restored = 0;
        for (WatchChannel channel : repository.findAll()) {
            if (channel.isLiveAt(clock.instant()) && !renewalTimers.containsKey(channel.resource())) {
                scheduleRenewal(channel);
                restored++;
            }
        }
        if (restored > 0) {
            log.info("Restored renewal timers for {} persisted channels", restored);
        }
        return restored;
    }

    /**
     * Best-effort stop of every tracked channel. Local state is cleared
     * whatever the provider answers.
     */
    public int stopAllChannels() {
        cancelAllTimers();
        int stopped = 0;
        for (WatchChannel channel : repository.findAll()) {
            stopRemote(channel);
            channel.setState(ChannelState.STOPPED);
            repository.delete(channel);
            stopped++;
        }
        log.info("Stopped {} watch channels", stopped);
        return stopped;
    }

    @PreDestroy
    public void shutdown() {
        if (!properties.getChannels().isStopOnShutdown()) {
            cancelAllTimers();
            return;
        }
        try {
            stopAllChannels();
        } catch (DataAccessException e) {
            log.error("Channel cleanup on shutdown failed: {}", e.getMessage());
        }
    }

    public void updateCheckpoint(String channelId, String checkpoint) {
        repository.findById(channelId).ifPresent(channel -> {
            channel.setCheckpoint(checkpoint);
            channel.setUpdatedAt(clock.instant());
            repository.save(channel);
        });
    }

    /**
     * Moves a resource's polling cursor up to a position push delivery has
     * already covered: a historyId for mail, an instant for calendars.
     * The cursor only ever moves forward.
     */
    public void advanceCheckpoint(WatchResource resource, String checkpoint) {
        if (checkpoint == null) {
            return;
        }
        repository.findByProviderAndResourceKey(resource.getProvider(), resource.getResourceKey())
                .filter(channel -> isAhead(resource.getProvider(), checkpoint, channel.getCheckpoint()))
                .ifPresent(channel -> {
                    log.debug("Advancing checkpoint: resource={}, from={}, to={}", resource, channel.getCheckpoint(), checkpoint);
                    channel.setCheckpoint(checkpoint);
                    channel.setUpdatedAt(clock.instant());
                    repository.save(channel);
                });
    }

    static boolean isAhead(WatchProvider provider, String candidate, String current) {
        if (current == null) {
            return true;
        }
        try {
            return provider == WatchProvider.GMAIL
                    ? new BigInteger(candidate).compareTo(new BigInteger(current)) > 0
                    : Instant.parse(candidate).isAfter(Instant.parse(current));
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Checkpoint not comparable, keeping current: provider={}, current={}, candidate={}",
                    provider, current, candidate);
            return false;
        }
    }

    public ChannelStats getStats() {
        Instant now = clock.instant();
        List<WatchChannel> channels = repository.findAll();
        Map<String, Long> byProvider = new TreeMap<>();
        for (WatchChannel channel : channels) {
            byProvider.merge(channel.getProvider().name(), 1L, Long::sum);
        }
        return ChannelStats.builder()
                .activeChannels(channels.stream().filter(c -> c.isLiveAt(now)).count())
                .totalChannels(channels.size())
                .byProvider(byProvider)
                .resources(channels.stream().map(c -> c.resource().toString()).sorted().collect(Collectors.toList()))
                .nextExpiration(channels.stream().map(WatchChannel::getExpiration)
                        .filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null))
                .oldestChannelCreatedAt(channels.stream().map(WatchChannel::getCreatedAt)
                        .filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null))
                .build();
    }

    boolean hasRenewalTimer(WatchResource resource) {
        return renewalTimers.containsKey(resource);
    }

    boolean hasPendingRetry(WatchResource resource) {
        return retryTimers.containsKey(resource);
    }

    private WatchChannel openChannel(WatchResource resource, String carriedCheckpoint) {
        SubscriptionClient client = clientFor(resource.getProvider());
        Instant now = clock.instant();
        Instant requestedExpiration = now.plus(ttlFor(resource.getProvider()));

        WatchChannel channel = WatchChannel.builder()
                .id(newChannelId(resource, now))
                .provider(resource.getProvider())
                .resourceKey(resource.getResourceKey())
                .token(UUID.randomUUID().toString())
                .expiration(requestedExpiration)
                .state(ChannelState.PENDING_CREATE)
                .createdAt(now)
                .updatedAt(now)
                .build();
        channel = repository.saveAndFlush(channel);

        try {
            WatchRegistration registration = client.watch(WatchRequest.builder()
                    .channelId(channel.getId())
                    .resourceKey(resource.getResourceKey())
                    .token(channel.getToken())
                    .address(callbackAddress(resource.getProvider()))
                    .expiration(requestedExpiration)
                    .build());

            Instant granted = registration.getExpiration();
            channel.setExpiration(granted != null && granted.isBefore(requestedExpiration) ? granted : requestedExpiration);
            channel.setResourceId(registration.getResourceId());
            channel.setResourceUri(registration.getResourceUri());
            channel.setCheckpoint(carriedCheckpoint != null ? carriedCheckpoint : registration.getCheckpoint());
            channel.setState(ChannelState.ACTIVE);
            channel.setUpdatedAt(clock.instant());
            channel = repository.save(channel);
        } catch (RuntimeException e) {
            repository.deleteById(channel.getId());
            log.error("Watch channel create failed: resource={}, error={}", resource, e.getMessage());
            throw e;
        }

        scheduleRenewal(channel);
        log.info("Watch channel created: resource={}, channelId={}, token={}, expiration={}",
                resource, channel.getId(), channel.maskedToken(), channel.getExpiration());
        return channel;
    }

    /**
     * Stops a channel remotely (best effort) and forgets it locally.
     * Returns its checkpoint so a replacement can continue from it.
     */
    private String retire(WatchChannel channel) {
        cancelRenewalTimer(channel.resource());
        if (channel.getState() != ChannelState.PENDING_CREATE) {
            stopRemote(channel);
        }
        repository.delete(channel);
        return channel.getCheckpoint();
    }

    private void stopRemote(WatchChannel channel) {
        try {
            clientFor(channel.getProvider()).stop(channel.getId(), channel.getResourceId(), channel.getResourceKey());
            log.info("Watch channel stopped: resource={}, channelId={}", channel.resource(), channel.getId());
        } catch (SubscriptionApiException e) {
            // Non-fatal: the provider drops the channel at expiration anyway
            log.warn("Remote stop failed, removing locally: channelId={}, error={}", channel.getId(), e.getMessage());
        }
    }

    private void scheduleRenewal(WatchChannel channel) {
        WatchResource resource = channel.resource();
        Instant fireAt = channel.getExpiration().minus(properties.getChannels().getRenewalAdvance());
        Instant now = clock.instant();
        if (fireAt.isBefore(now)) {
            fireAt = now;
        }
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> renewChannel(resource), fireAt);
        ScheduledFuture<?> previous = renewalTimers.put(resource, timer);
        if (previous != null && previous != timer) {
            previous.cancel(false);
        }
        log.debug("Renewal scheduled: resource={}, at={}", resource, fireAt);
    }

    private void scheduleRetry(WatchResource resource) {
        Instant fireAt = clock.instant().plus(properties.getChannels().getRenewalRetryBackoff());
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> {
            retryTimers.remove(resource);
            renewChannel(resource);
        }, fireAt);
        ScheduledFuture<?> previous = retryTimers.put(resource, timer);
        if (previous != null && previous != timer) {
            previous.cancel(false);
        }
    }

    private void cancelRenewalTimer(WatchResource resource) {
        ScheduledFuture<?> timer = renewalTimers.remove(resource);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private void cancelAllTimers() {
        renewalTimers.values().forEach(timer -> timer.cancel(false));
        renewalTimers.clear();
        retryTimers.values().forEach(timer -> timer.cancel(false));
        retryTimers.clear();
    }

    private boolean isBusy(WatchResource resource) {
        return renewing.contains(resource) || retryTimers.containsKey(resource);
    }

    private Duration ttlFor(WatchProvider provider) {
        return provider == WatchProvider.GMAIL
                ? properties.getChannels().getGmailTtl()
                : properties.getChannels().getCalendarTtl();
    }

    private String callbackAddress(WatchProvider provider) {
        String base = properties.getWebhook().getCallbackBaseUrl();
        String path = provider == WatchProvider.GMAIL ? "/webhooks/gmail-push" : "/webhooks/calendar";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path;
    }

    /**
     * "calendar_team-example-com_1718000000000_k3f9xq": provider, resource,
     * creation millis, random suffix. Only [a-z0-9_-] survive.
     */
    private String newChannelId(WatchResource resource, Instant now) {
        String key = resource.getResourceKey().toLowerCase().replaceAll("[^a-z0-9]+", "-");
        if (key.length() > MAX_RESOURCE_KEY_IN_ID) {
            key = key.substring(0, MAX_RESOURCE_KEY_IN_ID);
        }
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return resource.getProvider().name().toLowerCase() + "_" + key + "_" + now.toEpochMilli() + "_" + suffix;
    }
}
