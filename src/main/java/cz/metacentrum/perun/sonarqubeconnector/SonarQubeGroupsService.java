package cz.metacentrum.perun.sonarqubeconnector;

import cz.metacentrum.perun.sonarqubeconnector.exceptions.GroupAlreadyExistsException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.GroupNotFoundException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.InsufficientPrivilegesException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedResponseException;

import java.util.List;
import java.util.Optional;

/**
 * SonarQubeGroupsService manages user groups of SonarQube.
 * <p>
 * Mutating operations look the group up by name first, so they can be repeated safely. Outcome is
 * reported by {@link CallResult#isChanged()} or by {@link GroupAlreadyExistsException} /
 * {@link GroupNotFoundException}, which callers wanting "desired state" semantics should treat as
 * successful no-op.
 * <p>
 * Any call rejected with HTTP 403 is reported as {@link InsufficientPrivilegesException}.
 *
 * @author Perun Team
 */
public interface SonarQubeGroupsService {

	/**
	 * List groups visible to the token.
	 *
	 * @return groups from a single search call
	 * @throws InsufficientPrivilegesException when token is not allowed to search groups
	 * @throws UnexpectedResponseException when call fails for any other reason
	 */
	List<Group> listGroups() throws InsufficientPrivilegesException, UnexpectedResponseException;

	/**
	 * Find ID of the group with exactly the given name. Server search is fuzzy, so only exact
	 * match is taken.
	 *
	 * @param name name of the group
	 * @return ID of the group or empty if no group has this name
	 * @throws InsufficientPrivilegesException when token is not allowed to search groups
	 * @throws UnexpectedResponseException when call fails for any other reason
	 */
	Optional<String> findGroupIdByName(String name) throws InsufficientPrivilegesException, UnexpectedResponseException;

	/**
	 * Create group without description.
	 *
	 * @see #createGroup(String, String)
	 */
	CallResult createGroup(String name)
			throws GroupAlreadyExistsException, InsufficientPrivilegesException, UnexpectedResponseException;

	/**
	 * Create group if no group of the same name exists.
	 *
	 * @param name name of the group
	 * @param description description of the group, may be null
	 * @return server response stamped with changed=TRUE
	 * @throws GroupAlreadyExistsException when group already exists
	 * @throws InsufficientPrivilegesException when token is not allowed to manage groups
	 * @throws UnexpectedResponseException when call fails for any other reason
	 */
	CallResult createGroup(String name, String description)
			throws GroupAlreadyExistsException, InsufficientPrivilegesException, UnexpectedResponseException;

	/**
	 * Rename group. Nothing is sent to the server if group with the ID already has the name.
	 *
	 * @param id ID of the group
	 * @param name new name of the group
	 * @return server response stamped with changed=TRUE, or result with changed=FALSE and message when
	 * group already has the name
	 * @throws InsufficientPrivilegesException when token is not allowed to manage groups
	 * @throws UnexpectedResponseException when call fails for any other reason
	 */
	CallResult updateGroup(String id, String name) throws InsufficientPrivilegesException, UnexpectedResponseException;

	/**
	 * Delete group by its name.
	 *
	 * @param name name of the group
	 * @return server response stamped with changed=TRUE
	 * @throws GroupNotFoundException when there is no such group
	 * @throws InsufficientPrivilegesException when token is not allowed to manage groups
	 * @throws UnexpectedResponseException when call fails for any other reason
	 */
	CallResult deleteGroup(String name)
			throws GroupNotFoundException, InsufficientPrivilegesException, UnexpectedResponseException;

}
