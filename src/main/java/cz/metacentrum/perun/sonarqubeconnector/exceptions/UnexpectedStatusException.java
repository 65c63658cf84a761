package cz.metacentrum.perun.sonarqubeconnector.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Response status of a call was outside of the codes expected for its HTTP method.
 * <p>
 * Carries the decoded error payload, so callers can inspect messages sent back by SonarQube, e.g.
 * <pre>{"errors":[{"msg":"Group 'dev' already exists"}]}</pre>
 *
 * @author Perun Team
 */
public class UnexpectedStatusException extends SonarQubeException {

	private final String url;
	private final List<Integer> expectedStatusCodes;
	private final int statusCode;
	private final Map<String, Object> errorData;
	private final String responseBody;

	/**
	 * @param url full URL of the call
	 * @param expectedStatusCodes accepted codes, empty when any 2xx code is accepted
	 * @param statusCode actual status code
	 * @param errorData decoded JSON error payload, empty when body was empty or not a JSON object
	 * @param responseBody raw response body
	 */
	public UnexpectedStatusException(String url, List<Integer> expectedStatusCodes, int statusCode,
	                                 Map<String, Object> errorData, String responseBody) {
		super("Unexpected status code: " + statusCode + ", expected: " +
				(expectedStatusCodes.isEmpty() ? "2xx" : expectedStatusCodes) +
				", URL: " + url + ", Error Data: " + errorData);
		this.url = url;
		this.expectedStatusCodes = Collections.unmodifiableList(new ArrayList<>(expectedStatusCodes));
		this.statusCode = statusCode;
		this.errorData = Collections.unmodifiableMap(errorData);
		this.responseBody = (responseBody == null) ? "" : responseBody;
	}

	public String getUrl() {
		return url;
	}

	public List<Integer> getExpectedStatusCodes() {
		return expectedStatusCodes;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public Map<String, Object> getErrorData() {
		return errorData;
	}

	public String getResponseBody() {
		return responseBody;
	}

	/**
	 * Extract messages from standard SonarQube error payload ({@code errors[].msg}).
	 *
	 * @return list of error messages, empty if payload has different shape
	 */
	public List<String> getErrorMessages() {
		List<String> messages = new ArrayList<>();
		Object errors = errorData.get("errors");
		if (errors instanceof List) {
			for (Object error : (List<?>) errors) {
				if (error instanceof Map) {
					Object msg = ((Map<?, ?>) error).get("msg");
					if (msg != null) messages.add(msg.toString());
				}
			}
		}
		return messages;
	}
}
