package com.familygraph.repository;

import com.familygraph.model.ParentChild;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class ParentChildRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<ParentChild> PARENT_CHILD_MAPPER = (rs, rowNum) -> new ParentChild(
        rs.getString("parent_id"),
        rs.getString("child_id"),
        rs.getString("marriage_id")
    );

    public ParentChildRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<ParentChild> findAll() {
        return jdbc.query("SELECT * FROM parent_child ORDER BY seq", PARENT_CHILD_MAPPER);
    }

    public boolean exists(String parentId, String childId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM parent_child WHERE parent_id = ? AND child_id = ?",
            Integer.class,
            parentId, childId
        );
        return count != null && count > 0;
    }

    public void save(ParentChild relation) {
        jdbc.update(
            "INSERT INTO parent_child (parent_id, child_id, marriage_id) VALUES (?, ?, ?)",
            relation.parentId(), relation.childId(), relation.marriageId()
        );
    }

    /**
     * @return number of records removed
     */
    public int delete(String parentId, String childId) {
        return jdbc.update("DELETE FROM parent_child WHERE parent_id = ? AND child_id = ?", parentId, childId);
    }

    public int deleteByMarriage(String marriageId) {
        return jdbc.update("DELETE FROM parent_child WHERE marriage_id = ?", marriageId);
    }

    public int deleteByPerson(String personId) {
        return jdbc.update("DELETE FROM parent_child WHERE parent_id = ? OR child_id = ?", personId, personId);
    }

    public void deleteAll() {
        jdbc.update("DELETE FROM parent_child");
    }
}
