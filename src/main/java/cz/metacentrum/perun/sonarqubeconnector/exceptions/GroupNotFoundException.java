package cz.metacentrum.perun.sonarqubeconnector.exceptions;

/**
 * Operation targeted a group which does not exist.
 *
 * @author Perun Team
 */
public class GroupNotFoundException extends SonarQubeException {

	public GroupNotFoundException(String msg) {
		super(msg);
	}

	public GroupNotFoundException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
