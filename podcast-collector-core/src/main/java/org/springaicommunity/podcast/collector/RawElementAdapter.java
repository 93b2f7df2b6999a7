package org.springaicommunity.podcast.collector;

import org.jdom2.Attribute;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Namespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts feed XML elements into plain map graphs that are attached to parsed feeds and
 * entries as their {@code raw} value.
 *
 * <p>
 * Child elements are keyed by their qualified name as written in the document. A child
 * that occurs once maps to its value, repeated children map to a list. Attributes are
 * collected under {@code $} and text under {@code _}; an element with neither
 * attributes nor child elements maps to its trimmed text.
 */
public final class RawElementAdapter {

	static final Namespace RSS_1_NAMESPACE = Namespace.getNamespace("http://purl.org/rss/1.0/");

	static final Namespace ATOM_NAMESPACE = Namespace.getNamespace("http://www.w3.org/2005/Atom");

	private RawElementAdapter() {
	}

	/**
	 * The channel (RSS) or feed (Atom) element of a document.
	 * @param document parsed feed document
	 * @return the channel element, or the root element for Atom feeds
	 */
	public static Element channelElement(Document document) {
		Element root = document.getRootElement();
		for (Element child : root.getChildren()) {
			if ("channel".equals(child.getName())) {
				return child;
			}
		}
		return root;
	}

	/**
	 * Item elements of a document in document order: {@code rss/channel/item},
	 * {@code rdf:RDF/item} or {@code feed/entry}.
	 * @param document parsed feed document
	 * @return item elements
	 */
	public static List<Element> itemElements(Document document) {
		Element root = document.getRootElement();
		if ("feed".equals(root.getName())) {
			return root.getChildren("entry", root.getNamespace());
		}
		if ("RDF".equals(root.getName())) {
			return root.getChildren("item", RSS_1_NAMESPACE);
		}
		return channelElement(document).getChildren("item", channelElement(document).getNamespace());
	}

	/**
	 * Map an element, leaving out the named children.
	 * @param element the element
	 * @param excludedChildren local names of children to skip, e.g. {@code item}
	 * @return the map graph of the element
	 */
	public static Map<String, Object> toMap(Element element, Set<String> excludedChildren) {
		Map<String, Object> result = new LinkedHashMap<>();
		Map<String, String> attributes = attributes(element);
		if (!attributes.isEmpty()) {
			result.put(FieldProjector.ATTRIBUTES_KEY, attributes);
		}
		String text = element.getTextTrim();
		if (!text.isEmpty()) {
			result.put(FieldProjector.TEXT_KEY, text);
		}
		for (Element child : element.getChildren()) {
			if (excludedChildren.contains(child.getName())) {
				continue;
			}
			String key = child.getQualifiedName();
			Object value = toValue(child);
			Object existing = result.get(key);
			if (existing == null) {
				result.put(key, value);
			}
			else if (existing instanceof List<?>) {
				@SuppressWarnings("unchecked")
				List<Object> repeated = (List<Object>) existing;
				repeated.add(value);
			}
			else {
				List<Object> repeated = new ArrayList<>();
				repeated.add(existing);
				repeated.add(value);
				result.put(key, repeated);
			}
		}
		return result;
	}

	/**
	 * Map an element with all its children.
	 * @param element the element
	 * @return the map graph of the element
	 */
	public static Map<String, Object> toMap(Element element) {
		return toMap(element, Collections.emptySet());
	}

	private static Object toValue(Element element) {
		if (element.getChildren().isEmpty() && element.getAttributes().isEmpty()) {
			return element.getTextTrim();
		}
		return toMap(element);
	}

	private static Map<String, String> attributes(Element element) {
		Map<String, String> attributes = new LinkedHashMap<>();
		for (Attribute attribute : element.getAttributes()) {
			attributes.put(attribute.getQualifiedName(), attribute.getValue());
		}
		return attributes;
	}

}
