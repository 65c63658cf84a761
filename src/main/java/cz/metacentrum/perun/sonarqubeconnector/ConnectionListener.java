package cz.metacentrum.perun.sonarqubeconnector;

import cz.metacentrum.perun.sonarqubeconnector.exceptions.SonarQubeException;

/**
 * Receives events about calls performed by {@link SonarQubeConnection}.
 * Supplied by the caller, connection itself doesn't configure any logging.
 *
 * @author Perun Team
 */
public interface ConnectionListener {

	/**
	 * Listener ignoring all events.
	 */
	ConnectionListener NOOP = new ConnectionListener() {
		@Override
		public void callAttempted(String method, String url) {
		}

		@Override
		public void callSucceeded(String method, String url, int statusCode) {
		}

		@Override
		public void callFailed(String method, String url, SonarQubeException ex) {
		}
	};

	/**
	 * Called right before the request is sent.
	 *
	 * @param method HTTP method
	 * @param url full URL without query string
	 */
	void callAttempted(String method, String url);

	/**
	 * Called when response with expected status was received.
	 *
	 * @param method HTTP method
	 * @param url full URL without query string
	 * @param statusCode received status code
	 */
	void callSucceeded(String method, String url, int statusCode);

	/**
	 * Called when the call failed on transport level or with unexpected status.
	 *
	 * @param method HTTP method
	 * @param url full URL without query string
	 * @param ex exception which is about to be thrown to the caller
	 */
	void callFailed(String method, String url, SonarQubeException ex);
}
