package works.jsonlens.address;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.jsonlens.address.DocumentSurgeon.ElementSlot;
import works.jsonlens.address.DocumentSurgeon.MemberSlot;
import works.jsonlens.address.DocumentSurgeon.NodeLocation;
import works.jsonlens.address.DocumentSurgeon.Root;
import works.jsonlens.exceptions.AddressException;
import works.jsonlens.tree.JsonText;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.jsonlens.exceptions.AddressException.Reason.NO_MATCH;

class DocumentSurgeonTest {
	private final ObjectMapper mapper = JsonMapper.builder().build();
	private final DocumentSurgeon surgeon = new DocumentSurgeon();
	private JsonNode document;

	@BeforeEach
	void setUp() {
		document = mapper.readTree("{\"user\": {\"name\": \"someone\", \"tags\": [\"a\", \"b\"]}, \"odd key\": 1}");
	}

	@Test
	void find() {
		assertEquals("someone", JsonText.plain(surgeon.valueAt(document, Address.parse("$.user.name"))));
		assertEquals("b", JsonText.plain(surgeon.valueAt(document, Address.parse("$.user.tags[1]"))));
		assertEquals("1", JsonText.plain(surgeon.valueAt(document, Address.parse("$['odd key']"))));
		assertSame(document, surgeon.valueAt(document, Address.parse("$")));
	}

	@Test
	void find_wrongContainerKind_isEmpty() {
		assertTrue(surgeon.find(document, Address.parse("$.user[0]")).isEmpty());
		assertTrue(surgeon.find(document, Address.parse("$.user.tags.length")).isEmpty());
		assertTrue(surgeon.find(document, Address.parse("$.user.tags[2]")).isEmpty());
		assertTrue(surgeon.find(document, Address.parse("$.user.name.first")).isEmpty());
	}

	@Test
	void locate() {
		assertInstanceOf(Root.class, surgeon.locate(document, Address.parse("$")));
		NodeLocation member = surgeon.locate(document, Address.parse("$.user.name"));
		assertEquals("name", assertInstanceOf(MemberSlot.class, member).key());
		NodeLocation element = surgeon.locate(document, Address.parse("$.user.tags[0]"));
		assertEquals(0, assertInstanceOf(ElementSlot.class, element).index());
	}

	@Test
	void locate_missing_throwsNoMatch() {
		AddressException e = assertThrows(AddressException.class, () -> surgeon.locate(document, Address.parse("$.user.missing")));
		assertEquals(NO_MATCH, e.reason());
		e = assertThrows(AddressException.class, () -> surgeon.locate(document, Address.parse("$.nonexistent.path")));
		assertEquals(NO_MATCH, e.reason());
	}

	@Test
	void replace_member() {
		JsonNode result = surgeon.replace(document, surgeon.locate(document, Address.parse("$.user.tags[1]")), JsonText.stringNode("c"));
		assertSame(document, result);
		assertEquals("c", JsonText.plain(surgeon.valueAt(document, Address.parse("$.user.tags[1]"))));
		assertEquals("a", JsonText.plain(surgeon.valueAt(document, Address.parse("$.user.tags[0]"))));
	}

	@Test
	void replace_root_returnsReplacement() {
		JsonNode replacement = JsonText.stringNode("everything");
		assertSame(replacement, surgeon.replace(document, new Root(), replacement));
	}
}
