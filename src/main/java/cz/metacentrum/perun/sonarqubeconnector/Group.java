package cz.metacentrum.perun.sonarqubeconnector;

import java.util.Objects;

/**
 * User group as returned by SonarQube. Name is unique on the server, id is assigned by the server.
 *
 * @author Perun Team
 */
public class Group {

	private final String id;
	private String name;
	private final String description;

	public Group(String id, String name, String description) {
		this.id = id;
		this.name = name;
		this.description = description;
	}

	public String getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	/**
	 * @return description or null when group has none
	 */
	public String getDescription() {
		return description;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Group group = (Group) o;
		return Objects.equals(id, group.id) &&
				Objects.equals(name, group.name) &&
				Objects.equals(description, group.description);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, name, description);
	}

	@Override
	public String toString() {
		return "Group{id='" + id + "', name='" + name + "', description='" + description + "'}";
	}
}
