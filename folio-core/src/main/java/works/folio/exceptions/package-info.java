/**
 * Exceptions that can reach users of {@link works.folio.Document} and {@link works.folio.MutableDocument}.
 * <p>
 * Out-of-range indexes and offsets are reported with the standard {@link java.lang.IndexOutOfBoundsException},
 * and violated preconditions with {@link java.lang.IllegalArgumentException};
 * only conditions specific to documents get their own types here.
 */
package works.folio.exceptions;
