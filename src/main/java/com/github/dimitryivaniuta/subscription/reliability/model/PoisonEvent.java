package com.github.dimitryivaniuta.subscription.reliability.model;

import com.github.dimitryivaniuta.subscription.event.Event;

public record PoisonEvent(Event event, String reason) {
}
