package com.arbor.dispatch.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import com.arbor.dispatch.processor.DispatchTracing;
import com.arbor.dispatch.processor.TreeDispatcher;
import com.arbor.dispatch.receivers.EventDispatchBus;
import com.arbor.dispatch.receivers.LoggingUncaughtErrorSink;
import com.arbor.dispatch.receivers.UncaughtErrorSink;
import com.arbor.dispatch.tree.DispatchNode;
import com.arbor.dispatch.tree.DispatchTreeRenderer;

/**
 * Wires a ready-to-use {@link EventDispatchBus}. Every bean backs off when the application defines its own.
 * Applications add paths through {@link DispatchTreeCustomizer} beans.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableConfigurationProperties(DispatchProperties.class)
@RequiredArgsConstructor
public class AutoConfiguration {

	public static final String EXECUTOR_BEAN_NAME = "arborDispatchExecutor";

	private static final Logger log = LoggerFactory.getLogger(AutoConfiguration.class);

	private final DispatchProperties properties;

	@Bean(name = EXECUTOR_BEAN_NAME)
	@ConditionalOnMissingBean(name = EXECUTOR_BEAN_NAME)
	public Executor arborDispatchExecutor() {
		int threads = properties.getParallelism();
		if (threads <= 0) {
			return Runnable::run;
		}
		CustomizableThreadFactory factory = new CustomizableThreadFactory("arbor-dispatch-");
		factory.setDaemon(true);
		return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
	}

	@Bean
	@ConditionalOnMissingBean
	public TreeDispatcher treeDispatcher(@Qualifier(EXECUTOR_BEAN_NAME) Executor executor) {
		return new TreeDispatcher(executor);
	}

	@Bean
	@ConditionalOnMissingBean
	public DispatchTracing dispatchTracing(ObjectProvider<OpenTelemetry> openTelemetry) {
		return new DispatchTracing(openTelemetry.getIfAvailable(OpenTelemetry::noop));
	}

	@Bean
	@ConditionalOnMissingBean
	public UncaughtErrorSink uncaughtErrorSink() {
		return new LoggingUncaughtErrorSink(properties.getUncaughtLogLevel());
	}

	@Bean
	@ConditionalOnMissingBean
	public DispatchTreeRenderer dispatchTreeRenderer(ObjectProvider<ObjectMapper> mapper) {
		return new DispatchTreeRenderer(mapper.getIfAvailable());
	}

	@Bean
	@ConditionalOnMissingBean
	public DispatchNode dispatchTree(ObjectProvider<DispatchTreeCustomizer> customizers, DispatchTreeRenderer renderer) {
		DispatchNode tree = new DispatchNode();
		customizers.orderedStream().forEach(c -> c.customize(tree));
		log.info("arbor dispatch tree ready nodes={}", tree.nodeCount());
		if (properties.isLogTreeOnStartup() && log.isDebugEnabled()) {
			log.debug("dispatch tree:\n{}", renderer.render(tree));
		}
		return tree;
	}

	@Bean
	@ConditionalOnMissingBean
	public EventDispatchBus eventDispatchBus(
		DispatchNode dispatchTree,
		ObjectProvider<UncaughtErrorSink> uncaughtErrorSink,
		TreeDispatcher treeDispatcher,
		DispatchTracing dispatchTracing) {
		return new EventDispatchBus(dispatchTree, uncaughtErrorSink.getIfAvailable(), treeDispatcher, dispatchTracing);
	}
}
