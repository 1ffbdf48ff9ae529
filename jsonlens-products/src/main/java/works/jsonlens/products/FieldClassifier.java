package works.jsonlens.products;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.jsonlens.tree.JsonText;
import works.jsonlens.tree.NodeKind;

/**
 * Suggests filter terms by looking for field names that read as plain words.
 * <p>
 * The shape tests here are cheap character checks, not parsers.
 * They are neither locale-aware nor exact.
 */
public final class FieldClassifier {
	private FieldClassifier() {}

	public static final int MAX_CANDIDATES = 20;
	static final int MIN_LENGTH = 2;
	static final int MAX_LENGTH = 50;
	private static final List<String> URL_SCHEMES = List.of("http://", "https://", "ftp://", "ftps://");

	/**
	 * Visits every object member whose value is a string. Unless the value is timestamp- or version-shaped,
	 * collects the member's key, or the value itself if it is URL-shaped.
	 * Keeps only the collected strings that pass {@link #isPureCandidate}.
	 *
	 * @param leafOnly restricts consideration to members with scalar values
	 * @return at most {@link #MAX_CANDIDATES} distinct strings, in sorted order
	 */
	public static List<String> detectCandidateFields(JsonNode document, boolean leafOnly) {
		SortedSet<String> collected = new TreeSet<>();
		Deque<JsonNode> pending = new ArrayDeque<>();
		pending.push(document);
		while (!pending.isEmpty()) {
			JsonNode node = pending.pop();
			switch (NodeKind.of(node)) {
				case ARRAY -> {
					for (JsonNode element : node) {
						pending.push(element);
					}
				}
				case OBJECT -> {
					for (Map.Entry<String, JsonNode> member : node.properties()) {
						JsonNode value = member.getValue();
						NodeKind kind = NodeKind.of(value);
						if (kind == NodeKind.STRING && (!leafOnly || kind.isScalar())) {
							collect(member.getKey().trim(), JsonText.stringValue(value).trim(), collected);
						}
						pending.push(value);
					}
				}
				default -> {}
			}
		}
		List<String> result = collected.stream()
			.filter(s -> {
				String trimmed = s.trim();
				return trimmed.length() >= MIN_LENGTH && trimmed.length() <= MAX_LENGTH && isPureCandidate(trimmed);
			})
			.limit(MAX_CANDIDATES)
			.toList();
		LOGGER.debug("Collected {} strings; {} candidates", collected.size(), result.size());
		return result;
	}

	private static void collect(String key, String value, SortedSet<String> collected) {
		if (key.isEmpty() || isTimestampShaped(value) || isVersionShaped(value)) {
			return;
		}
		if (isUrlShaped(value)) {
			collected.add(value);
		} else {
			collected.add(key);
		}
	}

	/**
	 * True for strings made only of ASCII letters, underscores and hyphens,
	 * with at least one letter, that are not timestamp- or version-shaped.
	 */
	public static boolean isPureCandidate(String s) {
		long letters = s.chars().filter(FieldClassifier::isAsciiLetter).count();
		if (letters == 0) {
			return false;
		}
		if (isTimestampShaped(s) || isVersionShaped(s)) {
			return false;
		}
		long digits = s.chars().filter(c -> c >= '0' && c <= '9').count();
		if (digits > letters) {
			return false;
		}
		return s.chars().allMatch(c -> isAsciiLetter(c) || c == '_' || c == '-');
	}

	/**
	 * Recognizes <code>2023-01-01</code>, <code>12:34:56</code>,
	 * and anything of length 8 to 30 containing all of <code>T</code>, <code>-</code> and <code>:</code>.
	 */
	public static boolean isTimestampShaped(String s) {
		int len = s.length();
		if (len < 8 || len > 30) {
			return false;
		}
		boolean hasHyphen = s.indexOf('-') >= 0;
		boolean hasColon = s.indexOf(':') >= 0;
		boolean hasT = s.indexOf('T') >= 0;
		if (!hasHyphen && !hasColon && !hasT && s.indexOf('Z') < 0) {
			return false;
		}
		if (hasT && hasHyphen && hasColon) {
			return true;
		}
		if (count(s, '-') == 2 && len <= 12) {
			String[] parts = s.split("-", -1);
			if (parts[0].length() == 4 && parts[1].length() == 2 && parts[2].length() == 2
				&& allDigits(parts[0]) && allDigits(parts[1]) && allDigits(parts[2])) {
				return true;
			}
		}
		if (count(s, ':') == 2 && len <= 10) {
			String[] parts = s.split(":", -1);
			return allDigits(parts[0]) && allDigits(parts[1]) && allDigits(parts[2]);
		}
		return false;
	}

	/**
	 * Recognizes two to four dot-separated digit groups, optionally prefixed by <code>v</code> or <code>V</code>.
	 */
	public static boolean isVersionShaped(String s) {
		int len = s.length();
		if (len < 3 || len > 20 || s.indexOf('.') < 0) {
			return false;
		}
		String version = (s.charAt(0) == 'v' || s.charAt(0) == 'V') ? s.substring(1) : s;
		int dots = count(version, '.');
		if (dots < 1 || dots > 3) {
			return false;
		}
		for (String part : version.split("\\.", -1)) {
			if (part.isEmpty() || !allDigits(part)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Recognizes http, https, ftp and ftps URLs whose host part contains a dot or starts with <code>localhost</code>.
	 */
	public static boolean isUrlShaped(String s) {
		int len = s.length();
		if (len < 7 || len > 2000) {
			return false;
		}
		String lower = s.toLowerCase(Locale.ROOT);
		if (URL_SCHEMES.stream().noneMatch(lower::startsWith)) {
			return false;
		}
		int schemeEnd = lower.indexOf("://") + 3;
		if (len <= schemeEnd) {
			return false;
		}
		String rest = s.substring(schemeEnd);
		return rest.indexOf('.') >= 0 || rest.startsWith("localhost");
	}

	private static boolean isAsciiLetter(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean allDigits(String s) {
		return s.chars().allMatch(c -> c >= '0' && c <= '9');
	}

	private static int count(String s, char c) {
		return (int) s.chars().filter(x -> x == c).count();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldClassifier.class);
}
