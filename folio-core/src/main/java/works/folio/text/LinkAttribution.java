package works.folio.text;

import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * Associates a hyperlink with a span of text.
 * Links to different URLs are distinct and never merge,
 * even though they share the same {@link #id()}.
 */
public record LinkAttribution(URI url) implements Attribution {
	public static final String ID = "link";

	public LinkAttribution {
		requireNonNull(url);
	}

	public static LinkAttribution to(String url) {
		return new LinkAttribution(URI.create(url));
	}

	@Override
	public String id() {
		return ID;
	}

	@Override
	public boolean canMergeWith(Attribution other) {
		return other instanceof LinkAttribution link && link.url.equals(url);
	}

	@Override
	public String toString() {
		return "LinkAttribution(" + url + ")";
	}
}
