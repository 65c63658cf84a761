package cz.metacentrum.perun.sonarqubeconnector;

import com.google.api.client.googleapis.GoogleUtils;
import com.google.api.client.http.HttpMethods;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.util.SslUtils;
import com.google.api.client.util.StreamingContent;
import org.slf4j.LoggerFactory;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * HttpTransport based on {@link HttpURLConnection}, which unlike {@link NetHttpTransport} sends request
 * content also with DELETE. SonarQube API accepts form-encoded parameters in the body of any method.
 * <p>
 * Server certificate is validated against Google's trust store (same as
 * {@code GoogleNetHttpTransport.newTrustedTransport()}), or not at all when TLS verification is off.
 *
 * @author Perun Team
 */
public class UrlConnectionHttpTransport extends HttpTransport {

	private final static org.slf4j.Logger log = LoggerFactory.getLogger(UrlConnectionHttpTransport.class);

	// sorted for binary search
	private static final String[] SUPPORTED_METHODS = {
			HttpMethods.DELETE, HttpMethods.GET, HttpMethods.HEAD, HttpMethods.OPTIONS,
			HttpMethods.POST, HttpMethods.PUT, HttpMethods.TRACE};

	private final SSLSocketFactory sslSocketFactory;
	private final HostnameVerifier hostnameVerifier;

	/**
	 * @param verifySsl FALSE to skip validation of server certificate and host name
	 * @throws GeneralSecurityException when SSL context can't be initialized
	 * @throws IOException when trust store can't be loaded
	 */
	public UrlConnectionHttpTransport(boolean verifySsl) throws GeneralSecurityException, IOException {
		if (verifySsl) {
			SSLContext sslContext = SslUtils.getTlsSslContext();
			SslUtils.initSslContext(sslContext, GoogleUtils.getCertificateTrustStore(), SslUtils.getPkixTrustManagerFactory());
			this.sslSocketFactory = sslContext.getSocketFactory();
			this.hostnameVerifier = null;
		} else {
			log.warn("Validation of SonarQube server certificate is disabled.");
			this.sslSocketFactory = SslUtils.trustAllSSLContext().getSocketFactory();
			this.hostnameVerifier = SslUtils.trustAllHostnameVerifier();
		}
	}

	@Override
	public boolean supportsMethod(String method) {
		return Arrays.binarySearch(SUPPORTED_METHODS, method) >= 0;
	}

	@Override
	protected LowLevelHttpRequest buildRequest(String method, String url) throws IOException {
		if (!supportsMethod(method)) {
			throw new IllegalArgumentException("HTTP method " + method + " is not supported.");
		}
		HttpURLConnection connection = (HttpURLConnection) new URL(url).openConnection();
		connection.setRequestMethod(method);
		connection.setInstanceFollowRedirects(false);
		if (connection instanceof HttpsURLConnection) {
			HttpsURLConnection secured = (HttpsURLConnection) connection;
			secured.setSSLSocketFactory(sslSocketFactory);
			if (hostnameVerifier != null) {
				secured.setHostnameVerifier(hostnameVerifier);
			}
		}
		return new Request(connection);
	}

	private static class Request extends LowLevelHttpRequest {

		private final HttpURLConnection connection;

		Request(HttpURLConnection connection) {
			this.connection = connection;
		}

		@Override
		public void addHeader(String name, String value) {
			connection.addRequestProperty(name, value);
		}

		@Override
		public void setTimeout(int connectTimeout, int readTimeout) {
			connection.setConnectTimeout(connectTimeout);
			connection.setReadTimeout(readTimeout);
		}

		@Override
		public LowLevelHttpResponse execute() throws IOException {
			StreamingContent content = getStreamingContent();
			if (content != null) {
				// setDoOutput would silently turn GET into POST
				if (HttpMethods.GET.equals(connection.getRequestMethod())) {
					throw new IllegalArgumentException("GET with content is not supported.");
				}
				if (getContentType() != null) {
					connection.setRequestProperty("Content-Type", getContentType());
				}
				if (getContentEncoding() != null) {
					connection.setRequestProperty("Content-Encoding", getContentEncoding());
				}
				long contentLength = getContentLength();
				if (contentLength >= 0) {
					connection.setFixedLengthStreamingMode(contentLength);
				} else {
					connection.setChunkedStreamingMode(0);
				}
				connection.setDoOutput(true);
				OutputStream out = connection.getOutputStream();
				try {
					content.writeTo(out);
				} finally {
					out.close();
				}
			} else {
				connection.connect();
			}
			return new Response(connection);
		}
	}

	private static class Response extends LowLevelHttpResponse {

		private final HttpURLConnection connection;
		private final int statusCode;
		private final String reasonPhrase;
		private final List<String> headerNames = new ArrayList<>();
		private final List<String> headerValues = new ArrayList<>();

		Response(HttpURLConnection connection) throws IOException {
			this.connection = connection;
			int code = connection.getResponseCode();
			this.statusCode = (code == -1) ? 0 : code;
			this.reasonPhrase = connection.getResponseMessage();
			for (int i = 0; ; i++) {
				String key = connection.getHeaderFieldKey(i);
				String value = connection.getHeaderField(i);
				if (key == null && value == null) {
					break;
				}
				// index 0 may hold the status line without a key
				if (key != null && value != null) {
					headerNames.add(key);
					headerValues.add(value);
				}
			}
		}

		@Override
		public InputStream getContent() throws IOException {
			try {
				return connection.getInputStream();
			} catch (IOException ex) {
				// 4xx / 5xx bodies are available only through the error stream
				return connection.getErrorStream();
			}
		}

		@Override
		public String getContentEncoding() {
			return connection.getContentEncoding();
		}

		@Override
		public long getContentLength() {
			return connection.getContentLengthLong();
		}

		@Override
		public String getContentType() {
			return connection.getHeaderField("Content-Type");
		}

		@Override
		public String getStatusLine() {
			String statusLine = connection.getHeaderField(0);
			return (statusLine != null && statusLine.startsWith("HTTP/1.")) ? statusLine : null;
		}

		@Override
		public int getStatusCode() {
			return statusCode;
		}

		@Override
		public String getReasonPhrase() {
			return reasonPhrase;
		}

		@Override
		public int getHeaderCount() {
			return headerNames.size();
		}

		@Override
		public String getHeaderName(int index) {
			return headerNames.get(index);
		}

		@Override
		public String getHeaderValue(int index) {
			return headerValues.get(index);
		}

		@Override
		public void disconnect() {
			connection.disconnect();
		}
	}
}
