package com.arbor.dispatch.configuration;

import com.arbor.dispatch.tree.DispatchNode;

/**
 * Callback for registering paths on the auto-configured dispatch tree. Customizers run once, in {@code @Order}, while
 * the tree bean is created and before anything can publish.
 *
 * <pre>{@code
 * @Bean
 * DispatchTreeCustomizer orderPaths(OrderHandler handler) {
 *     return tree -> PathBuilder.path()
 *         .and(Filters.typeIs(OrderPlaced.class))
 *         .and(Filters.handler(handler::onPlaced))
 *         .end(tree);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface DispatchTreeCustomizer {
	void customize(DispatchNode tree);
}
