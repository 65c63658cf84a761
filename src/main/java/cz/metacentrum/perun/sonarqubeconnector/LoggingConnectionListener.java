package cz.metacentrum.perun.sonarqubeconnector;

import cz.metacentrum.perun.sonarqubeconnector.exceptions.SonarQubeException;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ConnectionListener} writing call events to SLF4J.
 *
 * @author Perun Team
 */
public class LoggingConnectionListener implements ConnectionListener {

	private final static org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConnectionListener.class);

	@Override
	public void callAttempted(String method, String url) {
		log.debug("Calling {} {}", method, url);
	}

	@Override
	public void callSucceeded(String method, String url, int statusCode) {
		log.debug("Call {} {} returned {}", method, url, statusCode);
	}

	@Override
	public void callFailed(String method, String url, SonarQubeException ex) {
		log.warn("Call {} {} failed: {}", method, url, ex.getMessage());
	}
}
