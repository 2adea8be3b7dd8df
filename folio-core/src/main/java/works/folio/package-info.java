/**
 * The document containers: {@link works.folio.Document} for reading,
 * {@link works.folio.MutableDocument} for editing,
 * and the {@link works.folio.DocumentChangeEvent events} that editing produces.
 */
package works.folio;
