package org.lnwatch.event;

@FunctionalInterface
public interface Listener {

	void listen(Event event);

}
