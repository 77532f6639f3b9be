package com.contact.resolution.attribution;

import com.contact.resolution.core.ContactNotFoundException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.enhance.DealEnhancer;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Computes attribution chains for stored contacts, serving repeated reads from the cache.
 * Deals are enhanced before chain building so won deals always carry collected cash.
 */
public class AttributionService {
    private static final Logger log = LoggerFactory.getLogger(AttributionService.class);

    private final ContactStore contactStore;
    private final EventStore eventStore;
    private final AttributionChainBuilder builder;
    private final DealEnhancer dealEnhancer;
    private final AttributionCache cache;
    private final MetricsService metricsService;

    public AttributionService(ContactStore contactStore,
                              EventStore eventStore,
                              AttributionChainBuilder builder,
                              DealEnhancer dealEnhancer,
                              AttributionCache cache,
                              MetricsService metricsService) {
        this.contactStore = contactStore;
        this.eventStore = eventStore;
        this.builder = builder;
        this.dealEnhancer = dealEnhancer;
        this.cache = cache;
        this.metricsService = metricsService;
    }

    /**
     * Returns one scored chain per deal of the contact, in deal order.
     *
     * @throws ContactNotFoundException if the contact does not exist
     */
    public List<AttributionChain> attribute(String contactId) {
        try (LogContext ctx = LogContext.forAttribution(LogContext.generateCorrelationId(), contactId)) {
            long generation = cache.generation(contactId);
            return chainsFor(requireContact(contactId), generation);
        }
    }

    /**
     * Chains of the contact together with its overall attribution certainty.
     *
     * @throws ContactNotFoundException if the contact does not exist
     */
    public ContactAttribution summarize(String contactId) {
        try (LogContext ctx = LogContext.forAttribution(LogContext.generateCorrelationId(), contactId)) {
            long generation = cache.generation(contactId);
            Contact contact = requireContact(contactId);
            List<AttributionChain> chains = chainsFor(contact, generation);
            List<Event> events = chains.isEmpty() ? eventStore.eventsForContact(contactId) : List.of();
            double certainty = AttributionCertainty.forContact(contact, chains, events);
            log.debug("attribution.summarized contactId={} chains={} certainty={}",
                    contactId, chains.size(), certainty);
            return new ContactAttribution(contactId, chains, certainty);
        }
    }

    /**
     * @param generation cache generation read before the contact, so a write landing after
     *                   either read makes the put a no-op
     */
    private List<AttributionChain> chainsFor(Contact contact, long generation) {
        String contactId = contact.getId();
        Optional<List<AttributionChain>> cached = cache.get(contactId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("attribution.cache.hit contactId={}", contactId);
            return cached.get();
        }
        metricsService.recordCacheMiss();

        List<Event> events = dealEnhancer.enhanceAll(eventStore.eventsForContact(contactId));
        List<AttributionChain> chains = builder.buildChains(contactId, events).stream()
                .map(chain -> chain.withCertainty(AttributionCertainty.forChain(contact, chain)))
                .toList();
        cache.put(contactId, generation, chains);
        for (AttributionChain chain : chains) {
            metricsService.incrementChainsBuilt(chain.model());
        }
        log.info("attribution.computed contactId={} events={} chains={}",
                contactId, events.size(), chains.size());
        return chains;
    }

    private Contact requireContact(String contactId) {
        return contactStore.findById(contactId)
                .orElseThrow(() -> new ContactNotFoundException(contactId));
    }

    /**
     * Chronological timeline of the contact's events, with deals enhanced.
     *
     * @throws ContactNotFoundException if the contact does not exist
     */
    public List<Event> timeline(String contactId) {
        requireContact(contactId);
        return builder.timeline(dealEnhancer.enhanceAll(eventStore.eventsForContact(contactId)));
    }
}
