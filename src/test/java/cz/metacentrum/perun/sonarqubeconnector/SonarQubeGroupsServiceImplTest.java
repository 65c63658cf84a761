package cz.metacentrum.perun.sonarqubeconnector;

import cz.metacentrum.perun.sonarqubeconnector.exceptions.ConfigurationException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.GroupAlreadyExistsException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.GroupNotFoundException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.InsufficientPrivilegesException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.SonarQubeException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.TransportException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedResponseException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedStatusException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SonarQubeGroupsServiceImpl} against in-memory SonarQube.
 */
class SonarQubeGroupsServiceImplTest {

	private static final String BASE_URL = "http://sonar.example.com";

	private FakeSonarQubeTransport transport;
	private SonarQubeGroupsService service;

	@BeforeEach
	void setUp() throws ConfigurationException {
		transport = new FakeSonarQubeTransport();
		service = new SonarQubeGroupsServiceImpl(
				new SonarQubeConnectionImpl(BASE_URL, "token", transport, ConnectionListener.NOOP));
	}

	@Test
	void scenario_createDeleteAndRepeat() throws SonarQubeException {
		transport.withGroup("1", "dev");

		assertThatThrownBy(() -> service.createGroup("dev")).isInstanceOf(GroupAlreadyExistsException.class);

		CallResult created = service.createGroup("qa");
		Map<String, Object> expected = new LinkedHashMap<>();
		expected.put("id", "2");
		expected.put("name", "qa");
		expected.put("changed", true);
		assertThat(created.asMap()).isEqualTo(expected);

		CallResult deleted = service.deleteGroup("qa");
		assertThat(deleted.isChanged()).isTrue();
		assertThat(deleted.asMap()).containsOnlyKeys("changed");
		assertThat(transport.getRequests()).last()
				.satisfies(request -> assertThat(request.getForm()).containsEntry("id", "2"));

		assertThatThrownBy(() -> service.deleteGroup("qa")).isInstanceOf(GroupNotFoundException.class);
		assertThat(transport.getGroups()).containsOnlyKeys("1");
	}

	@Test
	void createGroup_twice_secondReportsAlreadyExists() throws SonarQubeException {
		service.createGroup("ops", "Operations");

		assertThatThrownBy(() -> service.createGroup("ops", "Operations"))
				.isInstanceOf(GroupAlreadyExistsException.class)
				.hasMessageContaining("ops");
		assertThat(transport.getGroups()).hasSize(1);
	}

	@Test
	void createGroup_sendsNameAndDescription() throws SonarQubeException {
		service.createGroup("ops", "Operations team");

		FakeSonarQubeTransport.RecordedRequest create = transport.getRequests().get(1);
		assertThat(create.getPath()).isEqualTo(SonarQubeGroupsServiceImpl.CREATE_PATH);
		assertThat(create.getForm()).containsEntry("name", "ops").containsEntry("description", "Operations team");
	}

	@Test
	void createGroup_withoutDescription_omitsField() throws SonarQubeException {
		service.createGroup("ops");

		assertThat(transport.getRequests().get(1).getForm()).containsOnlyKeys("name");
	}

	@Test
	void createGroup_concurrentlyCreated_reportsAlreadyExists() {
		transport.respondOnce(200, "{\"groups\":[]}")
				.respondOnce(400, "{\"errors\":[{\"msg\":\"Group 'ops' already exists\"}]}");

		assertThatThrownBy(() -> service.createGroup("ops"))
				.isInstanceOf(GroupAlreadyExistsException.class)
				.hasCauseInstanceOf(UnexpectedStatusException.class);
	}

	@Test
	void createGroup_otherFailure_reportsUnexpectedResponse() {
		transport.respondOnce(200, "{\"groups\":[]}")
				.respondOnce(500, "{\"errors\":[{\"msg\":\"boom\"}]}");

		assertThatThrownBy(() -> service.createGroup("ops"))
				.isInstanceOf(UnexpectedResponseException.class)
				.hasMessageContaining("boom");
	}

	@Test
	void findGroupIdByName_returnsOnlyExactMatch() throws SonarQubeException {
		transport.withGroup("1", "dev-ops").withGroup("2", "devs").withGroup("3", "dev").withGroup("4", "Dev");

		assertThat(service.findGroupIdByName("dev")).contains("3");
		assertThat(service.findGroupIdByName("de")).isEmpty();
		assertThat(transport.getRequests().get(0).getQueryParam("q")).isEqualTo("dev");
	}

	@Test
	void findGroupIdByName_notFound_returnsEmpty() throws SonarQubeException {
		assertThat(service.findGroupIdByName("nobody")).isEqualTo(Optional.empty());
	}

	@Test
	void findGroupIdByName_numericId_isRenderedAsString() throws SonarQubeException {
		transport.respondOnce(200, "{\"groups\":[{\"id\":12,\"name\":\"dev\"}]}");

		assertThat(service.findGroupIdByName("dev")).contains("12");
	}

	@Test
	void listGroups_parsesAllFields() throws SonarQubeException {
		transport.respondOnce(200, "{\"paging\":{\"total\":2},\"groups\":["
				+ "{\"id\":\"1\",\"name\":\"sonar-users\",\"description\":\"Every authenticated user\",\"membersCount\":3},"
				+ "{\"id\":\"2\",\"name\":\"admins\"}]}");

		List<Group> groups = service.listGroups();

		assertThat(groups).containsExactly(
				new Group("1", "sonar-users", "Every authenticated user"),
				new Group("2", "admins", null));
		FakeSonarQubeTransport.RecordedRequest search = transport.getRequests().get(0);
		assertThat(search.getPath()).isEqualTo(SonarQubeGroupsServiceImpl.SEARCH_PATH);
		assertThat(search.getQueryParam("q")).isNull();
	}

	@Test
	void listGroups_nullDescription_isAbsent() throws SonarQubeException {
		transport.respondOnce(200, "{\"groups\":[{\"id\":\"1\",\"name\":\"dev\",\"description\":null}]}");

		assertThat(service.listGroups()).containsExactly(new Group("1", "dev", null));
	}

	@Test
	void listGroups_nullGroups_returnsEmptyList() throws SonarQubeException {
		transport.respondOnce(200, "{\"groups\":null}");

		assertThat(service.listGroups()).isEmpty();
	}

	@Test
	void findGroupIdByName_nullId_reportsUnexpectedResponse() {
		transport.respondOnce(200, "{\"groups\":[{\"id\":null,\"name\":\"qa\"}]}");

		assertThatThrownBy(() -> service.findGroupIdByName("qa"))
				.isInstanceOf(UnexpectedResponseException.class)
				.hasMessageContaining("has no id");
	}

	@Test
	void deleteGroup_nullId_sendsNoDelete() {
		transport.respondOnce(200, "{\"groups\":[{\"id\":null,\"name\":\"qa\"}]}");

		assertThatThrownBy(() -> service.deleteGroup("qa")).isInstanceOf(UnexpectedResponseException.class);
		assertThat(transport.getRequests()).hasSize(1);
	}

	@Test
	void listGroups_missingGroupsKey_returnsEmptyList() throws SonarQubeException {
		transport.respondOnce(200, null);

		assertThat(service.listGroups()).isEmpty();
	}

	@Test
	void listGroups_malformedGroups_reportsUnexpectedResponse() {
		transport.respondOnce(200, "{\"groups\":\"none\"}").respondOnce(200, "{\"groups\":[\"dev\"]}");

		assertThatThrownBy(() -> service.listGroups()).isInstanceOf(UnexpectedResponseException.class);
		assertThatThrownBy(() -> service.listGroups()).isInstanceOf(UnexpectedResponseException.class);
	}

	@Test
	void listGroups_transportFailure_reportsUnexpectedResponse() {
		transport.failOnce(new SocketTimeoutException("Read timed out"));

		assertThatThrownBy(() -> service.listGroups())
				.isInstanceOf(UnexpectedResponseException.class)
				.hasCauseInstanceOf(TransportException.class)
				.hasMessageContaining("Read timed out");
	}

	@Test
	void updateGroup_alreadyNamed_makesNoWriteCall() throws SonarQubeException {
		transport.withGroup("1", "dev");

		CallResult result = service.updateGroup("1", "dev");

		assertThat(result.isChanged()).isFalse();
		assertThat(result.getMessage()).isEqualTo("Group already has the desired name");
		assertThat(result.asMap()).containsEntry("changed", false);
		assertThat(transport.getRequests()).hasSize(1);
		assertThat(transport.getRequests().get(0).getMethod()).isEqualTo("GET");
	}

	@Test
	void updateGroup_differentName_renames() throws SonarQubeException {
		transport.withGroup("1", "dev");

		CallResult result = service.updateGroup("1", "developers");

		assertThat(result.isChanged()).isTrue();
		assertThat(transport.getGroups().get("1").getName()).isEqualTo("developers");
		FakeSonarQubeTransport.RecordedRequest update = transport.getRequests().get(1);
		assertThat(update.getPath()).isEqualTo(SonarQubeGroupsServiceImpl.UPDATE_PATH);
		assertThat(update.getForm()).containsEntry("id", "1").containsEntry("name", "developers");
	}

	@Test
	void updateGroup_unknownId_reportsUnexpectedResponse() {
		assertThatThrownBy(() -> service.updateGroup("42", "developers"))
				.isInstanceOf(UnexpectedResponseException.class);
	}

	@Test
	void deleteGroup_concurrentlyDeleted_reportsNotFound() {
		transport.respondOnce(200, "{\"groups\":[{\"id\":\"9\",\"name\":\"ops\"}]}");

		assertThatThrownBy(() -> service.deleteGroup("ops"))
				.isInstanceOf(GroupNotFoundException.class)
				.hasCauseInstanceOf(UnexpectedStatusException.class);
	}

	@Test
	void deleteGroup_otherFailure_reportsUnexpectedResponse() {
		transport.withGroup("1", "dev").respondOnce(200, "{\"groups\":[{\"id\":\"1\",\"name\":\"dev\"}]}")
				.respondOnce(500, "{\"errors\":[{\"msg\":\"database is down\"}]}");

		assertThatThrownBy(() -> service.deleteGroup("dev")).isInstanceOf(UnexpectedResponseException.class);
	}

	@Test
	void forbidden_isReportedAsInsufficientPrivilegesByEveryOperation() {
		transport.withGroup("1", "dev").forbidAll();

		assertThatThrownBy(() -> service.listGroups()).isInstanceOf(InsufficientPrivilegesException.class);
		assertThatThrownBy(() -> service.findGroupIdByName("dev")).isInstanceOf(InsufficientPrivilegesException.class);
		assertThatThrownBy(() -> service.createGroup("qa")).isInstanceOf(InsufficientPrivilegesException.class);
		assertThatThrownBy(() -> service.updateGroup("1", "qa")).isInstanceOf(InsufficientPrivilegesException.class);
		assertThatThrownBy(() -> service.deleteGroup("dev"))
				.isInstanceOf(InsufficientPrivilegesException.class)
				.hasMessageContaining("token permissions");
	}

	@Test
	void forbiddenWrite_isReportedAsInsufficientPrivileges() {
		transport.withGroup("1", "dev")
				.respondOnce(200, "{\"groups\":[]}")
				.respondOnce(403, "{\"errors\":[{\"msg\":\"Insufficient privileges\"}]}")
				.respondOnce(200, "{\"groups\":[{\"id\":\"1\",\"name\":\"dev\"}]}")
				.respondOnce(403, null);

		assertThatThrownBy(() -> service.createGroup("qa")).isInstanceOf(InsufficientPrivilegesException.class);
		assertThatThrownBy(() -> service.deleteGroup("dev")).isInstanceOf(InsufficientPrivilegesException.class);
	}
}
