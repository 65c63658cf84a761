package cz.metacentrum.perun.sonarqubeconnector;

import com.google.api.client.util.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single call to SonarQube.
 * <p>
 * Holds decoded JSON object from the response body (empty when the body was empty), or the raw
 * text when the body was not a JSON object. Groups service additionally stamps {@code changed}
 * flag and optional informational message on it to report whether the operation mutated state.
 * These two are not part of the wire format.
 *
 * @author Perun Team
 */
public class CallResult {

	public static final String CHANGED = "changed";
	public static final String MESSAGE = "msg";

	private final Map<String, Object> content;
	private final String rawText;
	private final Boolean changed;
	private final String message;

	private CallResult(Map<String, Object> content, String rawText, Boolean changed, String message) {
		this.content = content;
		this.rawText = rawText;
		this.changed = changed;
		this.message = message;
	}

	/**
	 * @return result of a call with empty response body
	 */
	public static CallResult empty() {
		return new CallResult(Collections.<String, Object>emptyMap(), null, null, null);
	}

	/**
	 * @param content decoded JSON object
	 * @return result wrapping the decoded content
	 */
	public static CallResult of(Map<String, Object> content) {
		return new CallResult(Collections.unmodifiableMap(new LinkedHashMap<>(content)), null, null, null);
	}

	/**
	 * @param text response body which couldn't be decoded as JSON object
	 * @return result wrapping the raw text
	 */
	public static CallResult raw(String text) {
		return new CallResult(Collections.<String, Object>emptyMap(), text, null, null);
	}

	/**
	 * @param changed whether the operation mutated state on the server
	 * @return copy of this result with the flag set
	 */
	public CallResult withChanged(boolean changed) {
		return new CallResult(content, rawText, changed, message);
	}

	/**
	 * @param message informational message for the caller
	 * @return copy of this result with the message set
	 */
	public CallResult withMessage(String message) {
		return new CallResult(content, rawText, changed, message);
	}

	/**
	 * @return decoded JSON object, never null
	 */
	public Map<String, Object> getContent() {
		return content;
	}

	/**
	 * @return value under the key, null if missing or JSON null
	 */
	public Object get(String key) {
		Object value = content.get(key);
		return Data.isNull(value) ? null : value;
	}

	/**
	 * @return string form of the value under the key or null if missing or JSON null
	 */
	public String getString(String key) {
		Object value = get(key);
		return (value == null) ? null : value.toString();
	}

	public boolean isEmpty() {
		return content.isEmpty() && rawText == null;
	}

	public boolean isRaw() {
		return rawText != null;
	}

	public String getRawText() {
		return rawText;
	}

	/**
	 * @return TRUE only if the result was explicitly stamped as changed
	 */
	public boolean isChanged() {
		return Boolean.TRUE.equals(changed);
	}

	public String getMessage() {
		return message;
	}

	/**
	 * Flatten content together with {@code changed} and {@code msg} entries (when set) for reporting.
	 *
	 * @return new modifiable map
	 */
	public Map<String, Object> asMap() {
		Map<String, Object> result = new LinkedHashMap<>(content);
		if (message != null) result.put(MESSAGE, message);
		if (changed != null) result.put(CHANGED, changed);
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CallResult that = (CallResult) o;
		return Objects.equals(content, that.content) &&
				Objects.equals(rawText, that.rawText) &&
				Objects.equals(changed, that.changed) &&
				Objects.equals(message, that.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, rawText, changed, message);
	}

	@Override
	public String toString() {
		return isRaw() ? "CallResult{raw=" + rawText + ", changed=" + changed + "}" : "CallResult" + asMap();
	}
}
