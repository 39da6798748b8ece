package com.arbor.dispatch.tree;

import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.arbor.dispatch.filter.Filter;

/**
 * Renders a dispatch tree as JSON for diagnostics.
 *
 * <pre>{@code
 * {"and":[{"filter":"TypeFilter[String]","shared":false,"node":{...}}],"or":[],"catch":[]}
 * }</pre>
 *
 * A subtree reachable under several parents is rendered once per parent.
 */
public class DispatchTreeRenderer {

	private final ObjectMapper mapper;

	public DispatchTreeRenderer(ObjectMapper mapper) {
		// Use the application's mapper if provided; otherwise create a default.
		this.mapper = (mapper != null ? mapper.copy() : new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);
	}

	public DispatchTreeRenderer() {
		this(null);
	}

	public ObjectNode toJsonTree(DispatchNode node) {
		ObjectNode out = mapper.createObjectNode();
		for (Combinator c : Combinator.values()) {
			ArrayNode edges = out.putArray(c.name().toLowerCase(Locale.ROOT));
			for (Map.Entry<Filter, CowCell<DispatchNode>> e : node.edges(c).entrySet()) {
				ObjectNode edge = edges.addObject();
				edge.put("filter", String.valueOf(e.getKey()));
				edge.put("shared", !e.getValue().isOwned());
				edge.set("node", toJsonTree(e.getValue().view()));
			}
		}
		return out;
	}

	public String render(DispatchNode node) {
		try {
			return mapper.writeValueAsString(toJsonTree(node));
		} catch (JsonProcessingException e) {
			// Fallback to toString() if serialization fails
			return String.valueOf(node);
		}
	}
}
