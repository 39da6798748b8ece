package com.arbor.dispatch.configuration;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import com.arbor.dispatch.receivers.UncaughtLogLevel;

/** Settings under {@code arbor.dispatch.*}. */
@Getter
@Setter
@ConfigurationProperties(prefix = "arbor.dispatch")
public class DispatchProperties {

	/** Worker threads for sibling branches; 0 runs branches on the thread completing the parent stage. */
	private int parallelism = 0;

	/** Level at which the default sink logs uncaught failures. */
	private UncaughtLogLevel uncaughtLogLevel = UncaughtLogLevel.ERROR;

	/** Log the rendered tree at DEBUG once it has been built. */
	private boolean logTreeOnStartup = true;
}
