package cz.metacentrum.perun.sonarqubeconnector.exceptions;

/**
 * Operation targeted a group which already exists.
 *
 * @author Perun Team
 */
public class GroupAlreadyExistsException extends SonarQubeException {

	public GroupAlreadyExistsException(String msg) {
		super(msg);
	}

	public GroupAlreadyExistsException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
