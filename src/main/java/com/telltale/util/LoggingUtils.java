/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.telltale.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.LogManager.getLogManager;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Wires up the logging backend.
 * <p>
 * Telltale's filters log diagnostics through {@code java.util.logging} while its sinks write request records through
 * SLF4J. {@link #initializeLogback(Path, boolean)} configures Logback and bridges the former into the latter, so both
 * end up in the same appenders (structured JSON for {@code request.handler}, an hourly file for {@code healthd}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	private static final Object LOCK;

	static {
		LOCK = new Object();
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	public static void initializeLogback(@NonNull Path logbackConfigurationFile) {
		initializeLogback(logbackConfigurationFile, false);
	}

	/**
	 * Resets Logback from {@code logbackConfigurationFile} and routes {@code java.util.logging} through SLF4J.
	 *
	 * @param logbackConfigurationFile the Logback XML configuration
	 * @param printStatus              print Logback's internal status if configuration produced warnings or errors
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile,
																			 boolean printStatus) {
		requireNonNull(logbackConfigurationFile);

		synchronized (LOCK) {
			if (!Files.isRegularFile(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. No configuration file found at %s",
						logbackConfigurationFile.toAbsolutePath()));

			LoggerContext loggerContext = (LoggerContext) getILoggerFactory();

			try {
				JoranConfigurator configurator = new JoranConfigurator();
				configurator.setContext(loggerContext);
				loggerContext.reset();
				configurator.doConfigure(logbackConfigurationFile.toFile());
			} catch (JoranException e) {
				throw new IllegalStateException(format("Unable to configure Logback logging from %s",
						logbackConfigurationFile.toAbsolutePath()), e);
			}

			if (printStatus)
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			bridgeJavaUtilLogging();
		}
	}

	/**
	 * Replaces the root {@code java.util.logging} handlers with the SLF4J bridge. Safe to call more than once.
	 */
	public static void bridgeJavaUtilLogging() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				return;

			java.util.logging.Logger rootLogger = getLogManager().getLogger("");

			for (Handler handler : rootLogger.getHandlers())
				rootLogger.removeHandler(handler);

			SLF4JBridgeHandler.install();
		}
	}

	public static void uninstallJavaUtilLoggingBridge() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}

	public static boolean isJavaUtilLoggingBridged() {
		synchronized (LOCK) {
			return SLF4JBridgeHandler.isInstalled();
		}
	}
}
