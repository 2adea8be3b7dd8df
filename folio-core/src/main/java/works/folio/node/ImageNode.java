package works.folio.node;

import java.util.Map;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.folio.position.BinaryNodePosition;

import static java.util.Objects.requireNonNull;

/**
 * A block-level image. Having no text, it is addressed only by
 * {@link BinaryNodePosition#upstream() before} and {@link BinaryNodePosition#downstream() after}.
 *
 * @param width preferred display width, or null for the intrinsic width
 * @param height preferred display height, or null for the intrinsic height
 */
@With
public record ImageNode(
	String id,
	String imageUrl,
	@Nullable String altText,
	@Nullable Double width,
	@Nullable Double height,
	Map<String, Object> metadata
) implements DocumentNode {
	public ImageNode {
		id = NodeIds.validated(id);
		requireNonNull(imageUrl, "imageUrl");
		metadata = NodeIds.frozen(metadata);
	}

	public static ImageNode of(String id, String imageUrl) {
		return new ImageNode(id, imageUrl, null, null, null, Map.of());
	}

	@Override
	public BinaryNodePosition beginningPosition() {
		return BinaryNodePosition.upstream();
	}

	@Override
	public BinaryNodePosition endPosition() {
		return BinaryNodePosition.downstream();
	}
}
