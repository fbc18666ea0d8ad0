/*-
 * #%L
 * This file is part of SkyFind.
 * %%
 * Copyright (C) 2024 - 2026 SkyFind developers
 * %%
 * SkyFind is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SkyFind is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SkyFind.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package skyfind.lib.common;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 * <p>
 * Used where the same fallback can be applied for many objects or frames, and a single 
 * message is enough to tell the user what happened.
 * 
 * @author SkyFind developers
 */
public class LogTools {
	
	private static Map<Logger, Map<Level, Set<String>>> alreadyLogged = new ConcurrentHashMap<>();

	/**
	 * Log a message once at the specified level.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		var map = alreadyLogged.computeIfAbsent(logger, l -> new ConcurrentHashMap<>());
		var set = map.computeIfAbsent(level, l -> ConcurrentHashMap.newKeySet());
		if (set.add(message)) {
			logger.atLevel(level).log(message);
			return true;
		}
		return false;
	}

	/**
	 * Log a message once at the WARN level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}
	
	/**
	 * Log a formatted message once at the WARN level.
	 * The message is formatted before checking whether it has been seen, so different arguments 
	 * give different messages.
	 * 
	 * @param logger
	 * @param format format string, as used by {@link String#format(String, Object...)}
	 * @param args
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean warnOnce(Logger logger, String format, Object... args) {
		return logOnce(logger, Level.WARN, String.format(format, args));
	}

}
