package works.folio.node;

/**
 * How a {@link ParagraphNode} is meant to be presented.
 */
public enum ParagraphBlockType {
	PARAGRAPH,
	HEADER1,
	HEADER2,
	HEADER3,
	HEADER4,
	HEADER5,
	HEADER6,
	BLOCKQUOTE,
	CODE_BLOCK;

	public boolean isHeader() {
		return switch (this) {
			case HEADER1, HEADER2, HEADER3, HEADER4, HEADER5, HEADER6 -> true;
			default -> false;
		};
	}
}
