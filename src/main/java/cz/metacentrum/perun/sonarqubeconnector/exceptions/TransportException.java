package cz.metacentrum.perun.sonarqubeconnector.exceptions;

import java.util.Collections;
import java.util.Map;

/**
 * Network level failure (connection refused, timeout, TLS problem, ...) while calling SonarQube.
 * Not classified any further.
 *
 * @author Perun Team
 */
public class TransportException extends SonarQubeException {

	private final String url;
	private final Map<String, String> data;

	public TransportException(String url, Map<String, String> data, Throwable cause) {
		super("An error occurred: " + cause + ", URL: " + url + ", Data: " + (data == null ? "{}" : data), cause);
		this.url = url;
		this.data = (data == null) ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(data);
	}

	/**
	 * @return full URL of the failed call
	 */
	public String getUrl() {
		return url;
	}

	/**
	 * @return query parameters or form fields which were being sent, never null
	 */
	public Map<String, String> getData() {
		return data;
	}
}
