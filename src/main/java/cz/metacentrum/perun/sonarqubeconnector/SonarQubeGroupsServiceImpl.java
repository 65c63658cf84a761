package cz.metacentrum.perun.sonarqubeconnector;

import cz.metacentrum.perun.sonarqubeconnector.exceptions.GroupAlreadyExistsException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.GroupNotFoundException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.InsufficientPrivilegesException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.SonarQubeException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedResponseException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedStatusException;
import com.google.api.client.util.Data;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SonarQubeGroupsServiceImpl is an implementation of SonarQubeGroupsService interface.
 * <p>
 * It uses SonarQubeConnection to call user_groups web API. Every failure of the connection is
 * inspected: HTTP 403 becomes InsufficientPrivilegesException, messages about conflicting or
 * missing group become GroupAlreadyExistsException / GroupNotFoundException where the operation
 * allows it, anything else becomes UnexpectedResponseException.
 *
 * @author Perun Team
 */
public class SonarQubeGroupsServiceImpl implements SonarQubeGroupsService {

	private final static org.slf4j.Logger log = LoggerFactory.getLogger(SonarQubeGroupsServiceImpl.class);

	static final String SEARCH_PATH = "/api/user_groups/search";
	static final String CREATE_PATH = "/api/user_groups/create";
	static final String UPDATE_PATH = "/api/user_groups/update";
	static final String DELETE_PATH = "/api/user_groups/delete";

	private static final int FORBIDDEN = 403;
	private static final String[] ALREADY_EXISTS_MARKERS = {"already exists"};
	private static final String[] NOT_FOUND_MARKERS = {"not found", "no group", "does not exist"};

	private final SonarQubeConnection connection;

	public SonarQubeGroupsServiceImpl(SonarQubeConnection connection) {
		this.connection = Objects.requireNonNull(connection, "connection");
	}

	@Override
	public List<Group> listGroups() throws InsufficientPrivilegesException, UnexpectedResponseException {
		log.debug("Listing groups from {}", connection.getBaseUrl());
		return searchGroups(null);
	}

	@Override
	public Optional<String> findGroupIdByName(String name) throws InsufficientPrivilegesException, UnexpectedResponseException {

		Map<String, String> query = new LinkedHashMap<>();
		query.put("q", name);

		for (Group group : searchGroups(query)) {
			if (Objects.equals(group.getName(), name)) {
				if (group.getId() == null) {
					throw new UnexpectedResponseException("Unexpected response: group '" + name + "' has no id.");
				}
				return Optional.of(group.getId());
			}
		}
		log.debug("Group with name '{}' not found.", name);
		return Optional.empty();
	}

	@Override
	public CallResult createGroup(String name)
			throws GroupAlreadyExistsException, InsufficientPrivilegesException, UnexpectedResponseException {
		return createGroup(name, null);
	}

	@Override
	public CallResult createGroup(String name, String description)
			throws GroupAlreadyExistsException, InsufficientPrivilegesException, UnexpectedResponseException {

		if (findGroupIdByName(name).isPresent()) {
			throw new GroupAlreadyExistsException("Group '" + name + "' already exists.");
		}

		Map<String, String> data = new LinkedHashMap<>();
		data.put("name", name);
		if (description != null) {
			data.put("description", description);
		}

		try {
			log.debug("Creating group: {}", name);
			return connection.post(CREATE_PATH, data).withChanged(true);
		} catch (SonarQubeException ex) {
			checkPrivileges(ex);
			// somebody else created it between the lookup and our call
			if (mentions(ex, ALREADY_EXISTS_MARKERS)) {
				throw new GroupAlreadyExistsException("Group '" + name + "' already exists.", ex);
			}
			throw unexpected("creating group '" + name + "'", ex);
		}
	}

	@Override
	public CallResult updateGroup(String id, String name) throws InsufficientPrivilegesException, UnexpectedResponseException {

		Optional<String> currentId = findGroupIdByName(name);
		if (currentId.isPresent() && currentId.get().equals(id)) {
			log.debug("Group {} skipped, it is already named '{}'.", id, name);
			return CallResult.empty().withMessage("Group already has the desired name").withChanged(false);
		}

		Map<String, String> data = new LinkedHashMap<>();
		data.put("id", id);
		data.put("name", name);

		try {
			log.debug("Updating group {} to name '{}'", id, name);
			return connection.post(UPDATE_PATH, data).withChanged(true);
		} catch (SonarQubeException ex) {
			checkPrivileges(ex);
			throw unexpected("updating group " + id, ex);
		}
	}

	@Override
	public CallResult deleteGroup(String name)
			throws GroupNotFoundException, InsufficientPrivilegesException, UnexpectedResponseException {

		Optional<String> id = findGroupIdByName(name);
		if (!id.isPresent()) {
			throw new GroupNotFoundException("Group with name '" + name + "' not found.");
		}

		Map<String, String> data = new LinkedHashMap<>();
		data.put("id", id.get());

		try {
			log.debug("Deleting group: {} ({})", name, id.get());
			return connection.post(DELETE_PATH, data).withChanged(true);
		} catch (SonarQubeException ex) {
			checkPrivileges(ex);
			// somebody else deleted it between the lookup and our call
			if (mentions(ex, NOT_FOUND_MARKERS)) {
				throw new GroupNotFoundException("Group with name '" + name + "' not found.", ex);
			}
			throw unexpected("deleting group '" + name + "'", ex);
		}
	}

	/**
	 * Call search and convert "groups" array of the response.
	 *
	 * @param query query parameters or null
	 */
	private List<Group> searchGroups(Map<String, String> query) throws InsufficientPrivilegesException, UnexpectedResponseException {

		CallResult response;
		try {
			response = connection.get(SEARCH_PATH, query);
		} catch (SonarQubeException ex) {
			checkPrivileges(ex);
			throw unexpected("searching groups", ex);
		}

		Object groups = response.get("groups");
		if (groups == null || Data.isNull(groups)) {
			return Collections.emptyList();
		}
		if (!(groups instanceof List)) {
			throw new UnexpectedResponseException("Unexpected response: 'groups' is not an array: " + response);
		}

		List<Group> result = new ArrayList<>();
		for (Object item : (List<?>) groups) {
			if (!(item instanceof Map)) {
				throw new UnexpectedResponseException("Unexpected response: group entry is not an object: " + item);
			}
			result.add(toGroup((Map<?, ?>) item));
		}
		return result;
	}

	private static Group toGroup(Map<?, ?> json) {
		return new Group(asString(json.get("id")), asString(json.get("name")), asString(json.get("description")));
	}

	// numeric ids come as BigDecimal from the parser, JSON null as Data null placeholder
	private static String asString(Object value) {
		if (value == null || Data.isNull(value)) return null;
		if (value instanceof BigDecimal) return ((BigDecimal) value).toPlainString();
		return value.toString();
	}

	private static void checkPrivileges(SonarQubeException ex) throws InsufficientPrivilegesException {
		if (ex instanceof UnexpectedStatusException && ((UnexpectedStatusException) ex).getStatusCode() == FORBIDDEN) {
			throw new InsufficientPrivilegesException("Insufficient privileges to perform this action. Please check the token permissions.", ex);
		}
	}

	private static boolean mentions(SonarQubeException ex, String[] markers) {
		List<String> texts = new ArrayList<>();
		texts.add(ex.getMessage());
		if (ex instanceof UnexpectedStatusException) {
			texts.addAll(((UnexpectedStatusException) ex).getErrorMessages());
			texts.add(((UnexpectedStatusException) ex).getResponseBody());
		}
		for (String text : texts) {
			for (String marker : markers) {
				if (StringUtils.containsIgnoreCase(text, marker)) return true;
			}
		}
		return false;
	}

	private static UnexpectedResponseException unexpected(String action, SonarQubeException ex) {
		return new UnexpectedResponseException("Unexpected response while " + action + ": " + ex.getMessage(), ex);
	}

}
