package org.lnwatch.event;

import java.util.ArrayList;
import java.util.List;

/**
 * Synchronous event dispatch to registered listeners.
 * <p>
 * Each event source owns its own bus, so subscribers know exactly
 * which source they registered with and must unregister from it on shutdown.
 */
public class EventBus {

	private final List<Listener> listeners = new ArrayList<>();

	public void addListener(Listener newListener) {
		synchronized (this.listeners) {
			this.listeners.add(newListener);
		}
	}

	public void removeListener(Listener listener) {
		synchronized (this.listeners) {
			this.listeners.remove(listener);
		}
	}

	public int getListenerCount() {
		synchronized (this.listeners) {
			return this.listeners.size();
		}
	}

	/**
	 * Notifies a snapshot of current listeners, on the caller's thread.
	 * <p>
	 * Listeners added or removed during notification only take effect for later events.
	 */
	public void notify(Event event) {
		List<Listener> clonedListeners;

		synchronized (this.listeners) {
			clonedListeners = new ArrayList<>(this.listeners);
		}

		for (Listener listener : clonedListeners)
			listener.listen(event);
	}
}
