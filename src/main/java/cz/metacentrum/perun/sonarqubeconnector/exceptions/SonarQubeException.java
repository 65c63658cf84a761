package cz.metacentrum.perun.sonarqubeconnector.exceptions;

/**
 * Base of all checked exceptions raised while talking to SonarQube.
 *
 * @author Perun Team
 */
public class SonarQubeException extends Exception {

	public SonarQubeException() {
		super();
	}

	public SonarQubeException(String msg) {
		super(msg);
	}

	public SonarQubeException(Throwable cause) {
		super(cause);
	}

	public SonarQubeException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
