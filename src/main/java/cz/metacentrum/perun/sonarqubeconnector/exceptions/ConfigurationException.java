package cz.metacentrum.perun.sonarqubeconnector.exceptions;

/**
 * Thrown when the connection cannot be configured, e.g. the token is missing.
 *
 * @author Perun Team
 */
public class ConfigurationException extends SonarQubeException {

	public ConfigurationException(String msg) {
		super(msg);
	}

	public ConfigurationException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
