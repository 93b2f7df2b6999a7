package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.IllegalNameException;
import org.jdom2.Namespace;
import org.jdom2.Verifier;
import org.jdom2.output.Format;
import org.jdom2.output.XMLOutputter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes projected metadata next to downloaded files, as JSON or XML depending on the
 * file extension.
 *
 * <p>
 * XML output mirrors the map graph: keys become elements under a {@code root} element,
 * lists become repeated elements, {@code $} maps become attributes and {@code _} values
 * become text. Prefixed names such as {@code itunes:author} are bound to their usual
 * namespaces.
 */
public class SidecarMetadataWriter {

	static final String ROOT_ELEMENT = "root";

	private static final Map<String, String> KNOWN_NAMESPACES = Map.of("itunes",
			"http://www.itunes.com/dtds/podcast-1.0.dtd", "content", "http://purl.org/rss/1.0/modules/content/", "dc",
			"http://purl.org/dc/elements/1.1/", "atom", "http://www.w3.org/2005/Atom", "media",
			"http://search.yahoo.com/mrss/", "podcast", "https://podcastindex.org/namespace/1.0", "googleplay",
			"http://www.google.com/schemas/play-podcasts/1.0");

	private final ObjectMapper objectMapper;

	public SidecarMetadataWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Write metadata to a file, replacing existing content.
	 * @param path target file ending in {@code .json} or {@code .xml}
	 * @param data projected metadata
	 * @throws IllegalArgumentException if the extension is not a metadata format
	 * @throws IOException if the file cannot be written
	 */
	public void write(Path path, Map<String, Object> data) throws IOException {
		String name = path.getFileName().toString();
		String format = name.substring(name.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		if (MetadataFormat.JSON.extension().equals(format)) {
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
		}
		else if (MetadataFormat.XML.extension().equals(format)) {
			writeXml(path, data);
		}
		else {
			throw new IllegalArgumentException("Invalid metadata path " + path);
		}
	}

	private void writeXml(Path path, Map<String, Object> data) throws IOException {
		Element root = new Element(ROOT_ELEMENT);
		appendChildren(root, data);
		XMLOutputter outputter = new XMLOutputter(Format.getPrettyFormat().setEncoding("UTF-8"));
		try (OutputStream out = Files.newOutputStream(path)) {
			outputter.output(new Document(root), out);
		}
	}

	private void appendChildren(Element parent, Map<?, ?> data) {
		for (Map.Entry<?, ?> field : data.entrySet()) {
			String key = String.valueOf(field.getKey());
			Object value = field.getValue();
			if (FieldProjector.ATTRIBUTES_KEY.equals(key) && value instanceof Map<?, ?> attributes) {
				applyAttributes(parent, attributes);
			}
			else if (FieldProjector.TEXT_KEY.equals(key)) {
				parent.addContent(value != null ? String.valueOf(value) : "");
			}
			else if (value instanceof List<?> list) {
				for (Object item : list) {
					parent.addContent(toElement(key, item));
				}
			}
			else {
				parent.addContent(toElement(key, value));
			}
		}
	}

	private Element toElement(String name, Object value) {
		Element element = createElement(name);
		if (value instanceof Map<?, ?> map) {
			appendChildren(element, map);
		}
		else if (value instanceof List<?> list) {
			for (Object item : list) {
				element.addContent(toElement(name, item));
			}
		}
		else if (value != null) {
			element.setText(String.valueOf(value));
		}
		return element;
	}

	private void applyAttributes(Element element, Map<?, ?> attributes) {
		for (Map.Entry<?, ?> attribute : attributes.entrySet()) {
			String name = String.valueOf(attribute.getKey());
			if (name.equals("xmlns") || name.startsWith("xmlns:")) {
				continue;
			}
			String value = attribute.getValue() != null ? String.valueOf(attribute.getValue()) : "";
			int colon = name.indexOf(':');
			try {
				if (colon > 0) {
					element.setAttribute(name.substring(colon + 1), value, namespace(name.substring(0, colon)));
				}
				else {
					element.setAttribute(name, value);
				}
			}
			catch (IllegalNameException e) {
				element.setAttribute(safeLocalName(name), value);
			}
		}
	}

	private Element createElement(String name) {
		int colon = name.indexOf(':');
		if (colon > 0) {
			String local = name.substring(colon + 1);
			if (Verifier.checkElementName(local) == null) {
				return new Element(local, namespace(name.substring(0, colon)));
			}
		}
		return new Element(safeLocalName(name));
	}

	private static Namespace namespace(String prefix) {
		if (prefix.equals("xml")) {
			return Namespace.XML_NAMESPACE;
		}
		String uri = KNOWN_NAMESPACES.getOrDefault(prefix, "urn:podcast-collector:" + prefix);
		return Namespace.getNamespace(prefix, uri);
	}

	private static String safeLocalName(String name) {
		String candidate = name.replaceAll("[^A-Za-z0-9._-]", "_");
		if (candidate.isEmpty() || Verifier.checkElementName(candidate) != null) {
			candidate = "_" + candidate;
		}
		return candidate;
	}

}
