package autoexplore.snapshot;

import autoexplore.model.Element;
import autoexplore.model.ElementIdentity;

/**
 * Derives the deduplication key of an {@link Element} from its most specific
 * label: text, then accessibility text, then resource id, then bounds.
 *
 * <p>Label fields are compared after trimming; bounds are used verbatim, so an
 * element without any descriptor yields {@code "bounds:"}.
 */
public final class ElementIdentifier {

    private ElementIdentifier() {}

    public static ElementIdentity identify(Element element) {
        String text = trimmed(element.getText());
        if (!text.isEmpty()) {
            return ElementIdentity.of(ElementIdentity.TEXT_PREFIX + text);
        }
        String acc = trimmed(element.getAccessibilityText());
        if (!acc.isEmpty()) {
            return ElementIdentity.of(ElementIdentity.ACCESSIBILITY_PREFIX + acc);
        }
        String id = trimmed(element.getResourceId());
        if (!id.isEmpty()) {
            return ElementIdentity.of(ElementIdentity.ID_PREFIX + id);
        }
        String bounds = element.getBounds() == null ? "" : element.getBounds();
        return ElementIdentity.of(ElementIdentity.BOUNDS_PREFIX + bounds);
    }

    private static String trimmed(String s) {
        return s == null ? "" : s.strip();
    }
}
