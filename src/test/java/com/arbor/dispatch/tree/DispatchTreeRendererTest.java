package com.arbor.dispatch.tree;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.arbor.dispatch.filter.Filters;

class DispatchTreeRendererTest {

	private final DispatchTreeRenderer renderer = new DispatchTreeRenderer();

	@Test
	void rendersEdgesPerCombinator() throws Exception {
		DispatchNode subtree = PathBuilder.path().onError(Filters.errorIs(IllegalStateException.class)).build();
		DispatchNode tree = PathBuilder.path()
			.and(Filters.typeIs(String.class))
			.step(Combinator.OR, Filters.typeIs(Integer.class), subtree)
			.build();

		JsonNode json = new ObjectMapper().readTree(renderer.render(tree));

		JsonNode and = json.get("and");
		assertThat(and).hasSize(1);
		assertThat(and.get(0).get("filter").asText()).isEqualTo("TypeFilter[String]");
		assertThat(and.get(0).get("shared").asBoolean()).isFalse();

		JsonNode or = and.get(0).get("node").get("or");
		assertThat(or.get(0).get("filter").asText()).isEqualTo("TypeFilter[Integer]");
		assertThat(or.get(0).get("shared").asBoolean()).isTrue();
		assertThat(or.get(0).get("node").get("catch").get(0).get("filter").asText())
			.isEqualTo("ErrorTypeFilter[IllegalStateException]");
		assertThat(json.get("or")).isEmpty();
		assertThat(json.get("catch")).isEmpty();
	}

	@Test
	void emptyTreeRendersEmptyArrays() {
		assertThat(renderer.toJsonTree(new DispatchNode()).toString())
			.isEqualTo("{\"and\":[],\"or\":[],\"catch\":[]}");
	}
}
