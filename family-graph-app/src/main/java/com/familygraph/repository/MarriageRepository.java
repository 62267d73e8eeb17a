package com.familygraph.repository;

import com.familygraph.model.Marriage;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class MarriageRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Marriage> MARRIAGE_MAPPER = (rs, rowNum) -> new Marriage(
        rs.getString("id"),
        rs.getString("spouse1_id"),
        rs.getString("spouse2_id"),
        rs.getString("marriage_date"),
        rs.getInt("marriage_order")
    );

    public MarriageRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Marriage> findAll() {
        return jdbc.query("SELECT * FROM marriage ORDER BY seq", MARRIAGE_MAPPER);
    }

    public Optional<Marriage> findById(String id) {
        List<Marriage> results = jdbc.query("SELECT * FROM marriage WHERE id = ?", MARRIAGE_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Number of marriages in which either person takes part.
     */
    public int countInvolving(String personA, String personB) {
        Integer count = jdbc.queryForObject("""
            SELECT COUNT(*) FROM marriage
            WHERE spouse1_id IN (?, ?) OR spouse2_id IN (?, ?)
            """,
            Integer.class,
            personA, personB, personA, personB
        );
        return count != null ? count : 0;
    }

    public void save(Marriage marriage) {
        jdbc.update("""
            INSERT INTO marriage (id, spouse1_id, spouse2_id, marriage_date, marriage_order)
            VALUES (?, ?, ?, ?, ?)
            """,
            marriage.id(), marriage.spouse1Id(), marriage.spouse2Id(), marriage.marriageDate(), marriage.order()
        );
    }

    public void delete(String id) {
        jdbc.update("DELETE FROM marriage WHERE id = ?", id);
    }

    public int deleteByPerson(String personId) {
        return jdbc.update("DELETE FROM marriage WHERE spouse1_id = ? OR spouse2_id = ?", personId, personId);
    }

    public void deleteAll() {
        jdbc.update("DELETE FROM marriage");
    }
}
