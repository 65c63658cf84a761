package cz.metacentrum.perun.sonarqubeconnector;

import cz.metacentrum.perun.sonarqubeconnector.exceptions.TransportException;
import cz.metacentrum.perun.sonarqubeconnector.exceptions.UnexpectedStatusException;

import java.util.Map;

/**
 * Handles authenticated connection to SonarQube web API.
 * <p>
 * Every call concatenates base URL with the path (path must start with "/"), checks the status
 * code expected for the HTTP method and decodes the response body. It never interprets business
 * meaning of the response.
 *
 * @author Perun Team
 */
public interface SonarQubeConnection {

	/**
	 * @return base URL of the SonarQube server
	 */
	String getBaseUrl();

	/**
	 * Issue GET request. Expects status 200.
	 *
	 * @param path API path, e.g. /api/user_groups/search
	 * @param queryParams query string parameters, may be null
	 * @return decoded response
	 * @throws TransportException when request couldn't be performed
	 * @throws UnexpectedStatusException when status is not 200
	 */
	CallResult get(String path, Map<String, String> queryParams) throws TransportException, UnexpectedStatusException;

	/**
	 * Issue POST request with form-encoded body. Expects status 200, 201 or 204.
	 * <p>
	 * 204 is accepted on top of 200/201 on purpose: SonarQube answers user_groups/update and
	 * user_groups/delete with 204 No Content.
	 *
	 * @param path API path
	 * @param formData form fields
	 * @return decoded response
	 * @throws TransportException when request couldn't be performed
	 * @throws UnexpectedStatusException when status is not expected
	 */
	CallResult post(String path, Map<String, String> formData) throws TransportException, UnexpectedStatusException;

	/**
	 * Issue PUT request with form-encoded body. Expects status 200.
	 *
	 * @param path API path
	 * @param formData form fields
	 * @return decoded response
	 * @throws TransportException when request couldn't be performed
	 * @throws UnexpectedStatusException when status is not 200
	 */
	CallResult put(String path, Map<String, String> formData) throws TransportException, UnexpectedStatusException;

	/**
	 * Issue DELETE request with optional form-encoded body. Any 2xx status is accepted.
	 *
	 * @param path API path
	 * @param formData form fields, may be null
	 * @return decoded response
	 * @throws TransportException when request couldn't be performed
	 * @throws UnexpectedStatusException when status is not 2xx
	 */
	CallResult delete(String path, Map<String, String> formData) throws TransportException, UnexpectedStatusException;

}
