package com.github.dimitryivaniuta.subscription.batch;

import com.github.dimitryivaniuta.subscription.handling.EventHandler;

/**
 * How a batch is cut into delivery units before it reaches the inner handler. Chosen once per topic.
 */
public enum BatchHandlingStrategy {

    /**
     * The batch goes through unchanged in one call.
     */
    SINGLE_TYPE {
        @Override
        public EventHandler decorate(EventHandler inner) {
            return inner;
        }
    },

    /**
     * Only the last event of every key is delivered, in one call.
     */
    SINGLE_TYPE_LAST_BY_KEY {
        @Override
        public EventHandler decorate(EventHandler inner) {
            return new SingleTypeLastByKeyEventHandler(inner);
        }
    },

    /**
     * One call per key, each key's events in their original order.
     */
    ORDERED_WITHIN_KEY {
        @Override
        public EventHandler decorate(EventHandler inner) {
            return new OrderedWithinKeyEventHandler(inner);
        }
    },

    /**
     * One call per message type, each type's events in their original order.
     */
    ORDERED_WITHIN_TYPE {
        @Override
        public EventHandler decorate(EventHandler inner) {
            return new OrderedWithinTypeEventHandler(inner);
        }
    };

    public abstract EventHandler decorate(EventHandler inner);
}
