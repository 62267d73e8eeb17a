package com.familygraph.repository;

import com.familygraph.model.Person;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PersonRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Person> PERSON_MAPPER = (rs, rowNum) -> new Person(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("gender"),
        rs.getString("date_of_birth"),
        rs.getString("date_of_death"),
        rs.getString("photo_path"),
        rs.getString("notes"),
        rs.getDouble("x"),
        rs.getDouble("y")
    );

    public PersonRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Person> findAll() {
        return jdbc.query("SELECT * FROM person ORDER BY seq", PERSON_MAPPER);
    }

    public Optional<Person> findById(String id) {
        List<Person> results = jdbc.query(
            "SELECT * FROM person WHERE id = ?",
            PERSON_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean existsById(String id) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM person WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public void save(Person person) {
        jdbc.update("""
            INSERT INTO person (id, name, gender, date_of_birth, date_of_death, photo_path, notes, x, y)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            person.id(), person.name(), person.gender(), person.dateOfBirth(), person.dateOfDeath(),
            person.photoPath(), person.notes(), person.x(), person.y()
        );
    }

    public void update(Person person) {
        jdbc.update("""
            UPDATE person SET name = ?, gender = ?, date_of_birth = ?, date_of_death = ?,
                   photo_path = ?, notes = ?, x = ?, y = ?
            WHERE id = ?
            """,
            person.name(), person.gender(), person.dateOfBirth(), person.dateOfDeath(),
            person.photoPath(), person.notes(), person.x(), person.y(), person.id()
        );
    }

    /**
     * @return true if a person with that id exists
     */
    public boolean updatePosition(String id, double x, double y) {
        return jdbc.update("UPDATE person SET x = ?, y = ? WHERE id = ?", x, y, id) > 0;
    }

    public void delete(String id) {
        jdbc.update("DELETE FROM person WHERE id = ?", id);
    }

    public void deleteAll() {
        jdbc.update("DELETE FROM person");
    }
}
