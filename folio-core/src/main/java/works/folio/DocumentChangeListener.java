package works.folio;

import java.util.List;

/**
 * Receives the events emitted by each {@link MutableDocument} mutation.
 * <p>
 * Called synchronously, on the mutating thread, after the change has been applied,
 * so implementations should return quickly.
 */
@FunctionalInterface
public interface DocumentChangeListener {
	/**
	 * @param changes the complete, unmodifiable batch emitted by one mutation
	 */
	void documentChanged(List<DocumentChangeEvent> changes);
}
