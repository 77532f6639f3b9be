package com.contact.resolution.attribution;

import com.contact.resolution.core.model.event.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Distributes a deal's credit over a chain's ordered touchpoints.
 * <ul>
 *   <li>one touchpoint receives 1.0</li>
 *   <li>two touchpoints split the first and last shares, renormalized to sum to 1.0</li>
 *   <li>otherwise the first and last receive their shares and the middle share is divided
 *       evenly across the touchpoints between them</li>
 * </ul>
 */
public class TouchpointWeighting {

    public List<WeightedTouchpoint> weigh(AttributionChain chain, WeightingScheme scheme) {
        Objects.requireNonNull(chain, "chain is required");
        return weigh(chain.priorEvents(), scheme);
    }

    /**
     * Weighs the chain with the scheme suggested by its own shape.
     */
    public List<WeightedTouchpoint> weigh(AttributionChain chain) {
        return weigh(chain, WeightingScheme.suggest(chain.priorEvents()));
    }

    public List<WeightedTouchpoint> weigh(List<? extends Event> touchpoints, WeightingScheme scheme) {
        Objects.requireNonNull(scheme, "scheme is required");
        int n = touchpoints.size();
        List<WeightedTouchpoint> weighted = new ArrayList<>(n);
        if (n == 0) {
            return weighted;
        }
        if (n == 1) {
            weighted.add(new WeightedTouchpoint(touchpoints.get(0), 0, 1.0));
            return weighted;
        }
        if (n == 2) {
            double total = scheme.first() + scheme.last();
            weighted.add(new WeightedTouchpoint(touchpoints.get(0), 0, scheme.first() / total));
            weighted.add(new WeightedTouchpoint(touchpoints.get(1), 1, scheme.last() / total));
            return weighted;
        }
        double middleEach = scheme.middle() / (n - 2);
        for (int i = 0; i < n; i++) {
            double weight = i == 0 ? scheme.first() : i == n - 1 ? scheme.last() : middleEach;
            weighted.add(new WeightedTouchpoint(touchpoints.get(i), i, weight));
        }
        return weighted;
    }
}
