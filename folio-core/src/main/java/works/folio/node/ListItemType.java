package works.folio.node;

public enum ListItemType {
	UNORDERED,
	ORDERED
}
