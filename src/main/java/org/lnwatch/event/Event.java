package org.lnwatch.event;

public interface Event {
}
