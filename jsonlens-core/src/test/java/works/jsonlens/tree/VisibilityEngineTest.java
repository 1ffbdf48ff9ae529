package works.jsonlens.tree;

import java.util.List;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VisibilityEngineTest {
	private final List<IndexedNode> index = new ShadowTreeBuilder().build(JsonMapper.builder().build().readTree("""
		{
			"a": {"b": 1, "c": {"d": 2}},
			"e": [10, {"f": 3}],
			"Name": "upper"
		}"""));

	@Test
	void collapsed_onlyRootVisible() {
		VisibilityEngine.recomputeVisibility(index);
		assertThat(visibleAddresses(), contains("$"));
	}

	@Test
	void expandingChain_showsImmediateChildrenOnly() {
		expand("$");
		expand("$.a");
		VisibilityEngine.recomputeVisibility(index);
		assertThat(visibleAddresses(), contains("$", "$.a", "$.a.b", "$.a.c", "$.e", "$.Name"));
	}

	@Test
	void expandedUnderCollapsedParent_staysHidden() {
		expand("$.a.c");
		expand("$");
		VisibilityEngine.recomputeVisibility(index);
		assertThat(visibleAddresses(), contains("$", "$.a", "$.e", "$.Name"));
	}

	@Test
	void deepChain_singlePass() {
		expand("$");
		expand("$.e");
		expand("$.e[1]");
		VisibilityEngine.recomputeVisibility(index);
		assertThat(visibleAddresses(), contains("$", "$.a", "$.e", "$.e[0]", "$.e[1]", "$.e[1].f", "$.Name"));
	}

	@Test
	void toggle() {
		assertTrue(VisibilityEngine.toggleExpanded(index, "$"));
		assertThat(visibleAddresses(), contains("$", "$.a", "$.e", "$.Name"));
		assertTrue(VisibilityEngine.toggleExpanded(index, "$"));
		assertThat(visibleAddresses(), contains("$"));
	}

	@Test
	void toggleUnknownAddress_onlyRecomputes() {
		VisibilityEngine.applyFilter(index, "");
		assertFalse(VisibilityEngine.toggleExpanded(index, "$.nope"));
		assertThat(visibleAddresses(), contains("$"));
		assertTrue(index.stream().noneMatch(IndexedNode::isExpanded));
	}

	@Test
	void emptyFilter_showsEverything() {
		VisibilityEngine.recomputeVisibility(index);
		VisibilityEngine.applyFilter(index, "");
		assertTrue(index.stream().allMatch(IndexedNode::isVisible));
	}

	@Test
	void filter_replacesExpansionVisibility() {
		expand("$");
		VisibilityEngine.recomputeVisibility(index);
		VisibilityEngine.applyFilter(index, "c");
		assertThat(visibleAddresses(), contains("$.a.c", "$.a.c.d"));
	}

	@Test
	void filter_isCaseSensitive() {
		VisibilityEngine.applyFilter(index, "name");
		assertThat(visibleAddresses(), empty());
		VisibilityEngine.applyFilter(index, "Name");
		assertThat(visibleAddresses(), contains("$.Name"));
	}

	@Test
	void clearingFilter_doesNotRestoreExpansion() {
		expand("$");
		VisibilityEngine.recomputeVisibility(index);
		VisibilityEngine.applyFilter(index, "f");
		VisibilityEngine.applyFilter(index, "");
		assertTrue(index.stream().allMatch(IndexedNode::isVisible));
		VisibilityEngine.recomputeVisibility(index);
		assertThat(visibleAddresses(), contains("$", "$.a", "$.e", "$.Name"));
	}

	@Test
	void nestedLeafExpanded_isHarmless() {
		List<IndexedNode> small = new ShadowTreeBuilder().build(JsonMapper.builder().build().readTree("{\"a\": {\"b\": 1}}"));
		small.get(0).setExpanded(true);
		small.get(1).setExpanded(true);
		VisibilityEngine.recomputeVisibility(small);
		assertTrue(small.stream().allMatch(IndexedNode::isVisible));
	}

	private void expand(String address) {
		index.stream()
			.filter(n -> n.address().equals(address))
			.forEach(n -> n.setExpanded(true));
	}

	private List<String> visibleAddresses() {
		return index.stream()
			.filter(IndexedNode::isVisible)
			.map(IndexedNode::address)
			.toList();
	}
}
