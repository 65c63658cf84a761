package cz.metacentrum.perun.sonarqubeconnector.exceptions;

/**
 * Any other failure of a groups operation which could not be classified more specifically.
 *
 * @author Perun Team
 */
public class UnexpectedResponseException extends SonarQubeException {

	public UnexpectedResponseException(String msg) {
		super(msg);
	}

	public UnexpectedResponseException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
