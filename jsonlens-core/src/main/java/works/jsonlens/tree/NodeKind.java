package works.jsonlens.tree;

import tools.jackson.databind.JsonNode;

public enum NodeKind {
	OBJECT,
	ARRAY,
	STRING,
	NUMBER,
	BOOL,
	NULL;

	public boolean isScalar() {
		return this != OBJECT && this != ARRAY;
	}

	public static NodeKind of(JsonNode node) {
		return switch (node.getNodeType()) {
			case OBJECT -> OBJECT;
			case ARRAY -> ARRAY;
			case STRING, BINARY -> STRING;
			case NUMBER -> NUMBER;
			case BOOLEAN -> BOOL;
			case NULL, MISSING -> NULL;
			case POJO -> throw new IllegalArgumentException("Unexpected POJO node in document");
		};
	}
}
