package cz.metacentrum.perun.sonarqubeconnector;

import com.google.api.client.http.BasicAuthentication;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpContent;
import com.google.api.client.http.HttpMethods;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.UrlEncodedContent;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.ConfigurationException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.SonarQubeException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.TransportException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedStatusException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * SonarQubeConnectionImpl is an implementation of SonarQubeConnection interface.
 * <p>
 * Calls are authenticated by HTTP basic authentication with the user token as username and empty
 * password. Connection holds no mutable state after construction, so one instance can be shared
 * by multiple threads as long as the underlying HttpTransport is thread-safe.
 * <p>
 * Connection can be configured from a properties file:
 * <pre>
 * url=https://sonar.example.com
 * token=squ_...
 * verify_ssl=true
 * connect_timeout=20000
 * read_timeout=20000
 * </pre>
 *
 * @author Perun Team
 */
public class SonarQubeConnectionImpl implements SonarQubeConnection {

	private final static org.slf4j.Logger log = LoggerFactory.getLogger(SonarQubeConnectionImpl.class);

	private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

	public static final int DEFAULT_TIMEOUT = 20000;

	private static final List<Integer> GET_STATUS_CODES = Collections.singletonList(200);
	private static final List<Integer> POST_STATUS_CODES = Arrays.asList(200, 201, 204);
	private static final List<Integer> PUT_STATUS_CODES = Collections.singletonList(200);
	// empty = any 2xx
	private static final List<Integer> DELETE_STATUS_CODES = Collections.emptyList();

	private final String baseUrl;
	private final HttpRequestFactory requestFactory;
	private final ConnectionListener listener;

	/**
	 * Create connection with verified TLS and logging listener.
	 *
	 * @param baseUrl base URL of SonarQube, e.g. https://sonar.example.com
	 * @param token user token
	 * @throws ConfigurationException when token or URL is missing or transport can't be created
	 */
	public SonarQubeConnectionImpl(String baseUrl, String token) throws ConfigurationException {
		this(baseUrl, token, true);
	}

	/**
	 * Create connection with logging listener.
	 *
	 * @param baseUrl base URL of SonarQube
	 * @param token user token
	 * @param verifySsl FALSE to skip validation of server certificate
	 * @throws ConfigurationException when token or URL is missing or transport can't be created
	 */
	public SonarQubeConnectionImpl(String baseUrl, String token, boolean verifySsl) throws ConfigurationException {
		this(baseUrl, token, buildTransport(verifySsl), new LoggingConnectionListener());
	}

	/**
	 * Create connection reading its configuration from properties file.
	 *
	 * @param propertiesFile path to the properties file
	 * @throws ConfigurationException when file can't be read or doesn't contain valid configuration
	 */
	public SonarQubeConnectionImpl(String propertiesFile) throws ConfigurationException {
		this(loadProperties(propertiesFile));
	}

	private SonarQubeConnectionImpl(Properties prop) throws ConfigurationException {
		this(prop.getProperty("url"),
				prop.getProperty("token"),
				buildTransport(Boolean.parseBoolean(prop.getProperty("verify_ssl", "true").trim())),
				new LoggingConnectionListener(),
				parseTimeout(prop, "connect_timeout"),
				parseTimeout(prop, "read_timeout"));
	}

	public SonarQubeConnectionImpl(String baseUrl, String token, HttpTransport transport,
	                               ConnectionListener listener) throws ConfigurationException {
		this(baseUrl, token, transport, listener, DEFAULT_TIMEOUT, DEFAULT_TIMEOUT);
	}

	/**
	 * @param baseUrl base URL of SonarQube
	 * @param token user token
	 * @param transport HTTP transport to perform calls with
	 * @param listener receives events about performed calls, null for none
	 * @param connectTimeout connect timeout in milliseconds, 0 for infinite
	 * @param readTimeout read timeout in milliseconds, 0 for infinite
	 * @throws ConfigurationException when token or URL is missing
	 */
	public SonarQubeConnectionImpl(String baseUrl, String token, HttpTransport transport, ConnectionListener listener,
	                               final int connectTimeout, final int readTimeout) throws ConfigurationException {
		if (StringUtils.isBlank(token)) {
			throw new ConfigurationException("Authentication credentials are not provided. Set the token parameter.");
		}
		if (StringUtils.isBlank(baseUrl)) {
			throw new ConfigurationException("Base URL of SonarQube is not provided. Set the url parameter.");
		}
		if (connectTimeout < 0 || readTimeout < 0) {
			throw new ConfigurationException("Timeouts can't be negative.");
		}
		this.baseUrl = baseUrl;
		this.listener = (listener == null) ? ConnectionListener.NOOP : listener;

		final BasicAuthentication authentication = new BasicAuthentication(token, "");
		this.requestFactory = transport.createRequestFactory(new HttpRequestInitializer() {
			@Override
			public void initialize(HttpRequest request) {
				request.setInterceptor(authentication);
				request.setConnectTimeout(connectTimeout);
				request.setReadTimeout(readTimeout);
				request.setNumberOfRetries(0);
				// status codes are validated per method by the connection
				request.setThrowExceptionOnExecuteError(false);
			}
		});
	}

	@Override
	public String getBaseUrl() {
		return baseUrl;
	}

	@Override
	public CallResult get(String path, Map<String, String> queryParams) throws TransportException, UnexpectedStatusException {
		return call(HttpMethods.GET, path, queryParams, null, GET_STATUS_CODES);
	}

	@Override
	public CallResult post(String path, Map<String, String> formData) throws TransportException, UnexpectedStatusException {
		return call(HttpMethods.POST, path, null, emptyIfNull(formData), POST_STATUS_CODES);
	}

	@Override
	public CallResult put(String path, Map<String, String> formData) throws TransportException, UnexpectedStatusException {
		return call(HttpMethods.PUT, path, null, emptyIfNull(formData), PUT_STATUS_CODES);
	}

	@Override
	public CallResult delete(String path, Map<String, String> formData) throws TransportException, UnexpectedStatusException {
		return call(HttpMethods.DELETE, path, null, formData, DELETE_STATUS_CODES);
	}

	/**
	 * Construct the full URL for a given API path. No normalization of slashes is performed.
	 *
	 * @param path API path starting with "/"
	 * @return full URL
	 */
	String endpointUrl(String path) {
		return baseUrl + path;
	}

	/**
	 * Perform the call and decode the response. Either query parameters or form data are sent, never both.
	 */
	private CallResult call(String method, String path, Map<String, String> queryParams, Map<String, String> formData,
	                        List<Integer> expectedStatusCodes) throws TransportException, UnexpectedStatusException {

		String url = endpointUrl(path);
		Map<String, String> sentData = (queryParams != null) ? queryParams : formData;

		listener.callAttempted(method, url);

		int statusCode;
		String body;
		HttpResponse response = null;
		try {
			GenericUrl requestUrl = new GenericUrl(url);
			if (queryParams != null) {
				for (Map.Entry<String, String> param : queryParams.entrySet()) {
					requestUrl.set(param.getKey(), param.getValue());
				}
			}
			HttpContent content = (formData == null) ? null : new UrlEncodedContent(new LinkedHashMap<>(formData));

			HttpRequest request = requestFactory.buildRequest(method, requestUrl, content);
			response = request.execute();
			statusCode = response.getStatusCode();
			body = response.parseAsString();
		} catch (IOException | IllegalArgumentException | IllegalStateException ex) {
			// IAE/ISE come from transports rejecting the request, e.g. an unsupported method
			throw failed(method, url, new TransportException(url, sentData, ex));
		} finally {
			if (response != null) {
				try {
					response.disconnect();
				} catch (IOException ex) {
					log.warn("Problem with I/O operation while disconnecting from {}.", url, ex);
				}
			}
		}

		if (!isExpected(statusCode, expectedStatusCodes)) {
			Map<String, Object> errorData = decodeObject(body);
			throw failed(method, url, new UnexpectedStatusException(url, expectedStatusCodes, statusCode,
					(errorData == null) ? Collections.<String, Object>emptyMap() : errorData, body));
		}

		listener.callSucceeded(method, url, statusCode);
		return decode(body);
	}

	private <E extends SonarQubeException> E failed(String method, String url, E ex) {
		listener.callFailed(method, url, ex);
		return ex;
	}

	private static boolean isExpected(int statusCode, List<Integer> expectedStatusCodes) {
		if (expectedStatusCodes.isEmpty()) {
			return statusCode >= 200 && statusCode < 300;
		}
		return expectedStatusCodes.contains(statusCode);
	}

	/**
	 * Decode response body: empty body to empty result, JSON object to its content, anything else to raw text.
	 */
	static CallResult decode(String body) {
		if (body == null || body.isEmpty()) {
			return CallResult.empty();
		}
		Map<String, Object> content = decodeObject(body);
		if (content == null) {
			return CallResult.raw(body);
		}
		return CallResult.of(content);
	}

	/**
	 * @return decoded JSON object or null if body is empty or not a JSON object
	 */
	private static Map<String, Object> decodeObject(String body) {
		if (body == null || body.trim().isEmpty()) {
			return null;
		}
		try {
			GenericJson json = JSON_FACTORY.fromString(body, GenericJson.class);
			return (json == null) ? null : new LinkedHashMap<String, Object>(json);
		} catch (IOException | IllegalArgumentException ex) {
			log.debug("Response body is not a JSON object: {}", ex.getMessage());
			return null;
		}
	}

	private static Map<String, String> emptyIfNull(Map<String, String> formData) {
		return (formData == null) ? Collections.<String, String>emptyMap() : formData;
	}

	private static HttpTransport buildTransport(boolean verifySsl) throws ConfigurationException {
		try {
			return new UrlConnectionHttpTransport(verifySsl);
		} catch (GeneralSecurityException ex) {
			String msg = "Problem with general security while creating HttpTransport.";
			log.error(msg, ex);
			throw new ConfigurationException(msg, ex);
		} catch (IOException ex) {
			String msg = "Problem with I/O operation while creating HttpTransport.";
			log.error(msg, ex);
			throw new ConfigurationException(msg, ex);
		}
	}

	private static Properties loadProperties(String propertiesFile) throws ConfigurationException {

		Properties prop = new Properties();
		InputStream input = null;

		try {
			input = new FileInputStream(propertiesFile);
			prop.load(input);
			return prop;
		} catch (IOException ex) {
			String msg = "Problem with I/O operation while reading properties file '" + propertiesFile + "'.";
			log.error(msg, ex);
			throw new ConfigurationException(msg, ex);
		} finally {
			if (input != null) {
				try {
					input.close();
				} catch (IOException ex) {
					log.error("Problem with I/O operation while closing file '{}'.", propertiesFile, ex);
				}
			}
		}
	}

	private static int parseTimeout(Properties prop, String key) throws ConfigurationException {
		String value = prop.getProperty(key);
		if (StringUtils.isBlank(value)) {
			return DEFAULT_TIMEOUT;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException ex) {
			throw new ConfigurationException("Property '" + key + "' must be a number of milliseconds, but was: " + value, ex);
		}
	}

}
