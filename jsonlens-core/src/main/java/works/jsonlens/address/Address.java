package works.jsonlens.address;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import works.jsonlens.exceptions.AddressException;

/**
 * A parsed address expression locating one node within a document.
 * <p>
 * The supported forms are exactly those the shadow tree builder emits:
 * the root <code>$</code>, a member <code>.name</code>,
 * a bracketed member <code>['name']</code> (or <code>["name"]</code>),
 * and an array element <code>[n]</code>.
 * Wildcards, slices, filters, and recursive descent are rejected as malformed.
 */
public record Address(String text, List<Segment> segments) {
	public static final String ROOT = "$";

	public Address {
		segments = List.copyOf(segments);
	}

	public sealed interface Segment permits Member, Element {}

	public record Member(String key) implements Segment {}

	public record Element(int index) implements Segment {}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public Segment lastSegment() {
		return segments.get(segments.size() - 1);
	}

	/**
	 * @return the segments leading to the node containing this one
	 * @throws IllegalStateException if this is the root
	 */
	public List<Segment> parentSegments() {
		if (isRoot()) {
			throw new IllegalStateException("Root has no parent");
		}
		return segments.subList(0, segments.size() - 1);
	}

	/**
	 * @return the address of member <code>key</code> of the object at <code>parent</code>.
	 * Keys that aren't plain words are bracketed, with <code>\</code> and <code>'</code> escaped by a backslash.
	 */
	public static String member(String parent, String key) {
		if (PLAIN_KEY.matcher(key).matches()) {
			return parent + "." + key;
		} else {
			return parent + "['" + key.replace("\\", "\\\\").replace("'", "\\'") + "']";
		}
	}

	/**
	 * @return the address of element <code>index</code> of the array at <code>parent</code>
	 */
	public static String element(String parent, int index) {
		return parent + "[" + index + "]";
	}

	public static Address parse(String text) {
		if (!text.startsWith(ROOT)) {
			throw AddressException.malformed(text, "must start with " + ROOT);
		}
		List<Segment> segments = new ArrayList<>();
		int pos = 1;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == '.') {
				int start = pos + 1;
				int end = start;
				while (end < text.length() && text.charAt(end) != '.' && text.charAt(end) != '[') {
					end++;
				}
				String key = text.substring(start, end);
				if (key.isEmpty()) {
					throw AddressException.malformed(text, "empty member name at offset " + pos);
				} else if (key.equals("*")) {
					throw AddressException.malformed(text, "wildcards are not supported");
				}
				segments.add(new Member(key));
				pos = end;
			} else if (c == '[') {
				pos = parseBracket(text, pos + 1, segments);
			} else {
				throw AddressException.malformed(text, "unexpected '" + c + "' at offset " + pos);
			}
		}
		return new Address(text, segments);
	}

	/**
	 * @param pos the offset just after the opening bracket
	 * @return the offset just after the closing bracket
	 */
	private static int parseBracket(String text, int pos, List<Segment> segments) {
		if (pos >= text.length()) {
			throw AddressException.malformed(text, "unterminated bracket");
		}
		char first = text.charAt(pos);
		if (first == '\'' || first == '"') {
			StringBuilder key = new StringBuilder();
			int i = pos + 1;
			while (true) {
				if (i >= text.length()) {
					throw AddressException.malformed(text, "unterminated quoted member name");
				}
				char c = text.charAt(i);
				if (c == '\\' && i + 1 < text.length() && (text.charAt(i + 1) == first || text.charAt(i + 1) == '\\')) {
					key.append(text.charAt(i + 1));
					i += 2;
				} else if (c == first) {
					break;
				} else {
					key.append(c);
					i++;
				}
			}
			int close = i + 1;
			if (close >= text.length() || text.charAt(close) != ']') {
				throw AddressException.malformed(text, "expected ']' at offset " + close);
			}
			segments.add(new Member(key.toString()));
			return close + 1;
		} else {
			int close = text.indexOf(']', pos);
			if (close == -1) {
				throw AddressException.malformed(text, "unterminated bracket");
			}
			String digits = text.substring(pos, close);
			if (!DIGITS.matcher(digits).matches()) {
				throw AddressException.malformed(text, "unsupported selector [" + digits + "]");
			}
			try {
				segments.add(new Element(Integer.parseInt(digits)));
			} catch (NumberFormatException e) {
				throw AddressException.malformed(text, "index out of range [" + digits + "]");
			}
			return close + 1;
		}
	}

	@Override
	public String toString() {
		return text;
	}

	private static final Pattern PLAIN_KEY = Pattern.compile("[A-Za-z0-9_]+");
	private static final Pattern DIGITS = Pattern.compile("[0-9]+");
}
