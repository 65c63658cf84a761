package cz.metacentrum.perun.sonarqubeconnector.exceptions;

/**
 * Server refused the action (HTTP 403). Usually the token lacks the administer permission.
 *
 * @author Perun Team
 */
public class InsufficientPrivilegesException extends SonarQubeException {

	public InsufficientPrivilegesException(String msg) {
		super(msg);
	}

	public InsufficientPrivilegesException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
