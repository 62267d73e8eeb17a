package com.familygraph.service;

import com.familygraph.model.Person;
import com.familygraph.repository.MarriageRepository;
import com.familygraph.repository.ParentChildRepository;
import com.familygraph.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class PersonService {

    private static final Logger log = LoggerFactory.getLogger(PersonService.class);

    private final PersonRepository personRepository;
    private final MarriageRepository marriageRepository;
    private final ParentChildRepository parentChildRepository;
    private final TreeStateService treeStateService;

    public PersonService(PersonRepository personRepository,
                         MarriageRepository marriageRepository,
                         ParentChildRepository parentChildRepository,
                         TreeStateService treeStateService) {
        this.personRepository = personRepository;
        this.marriageRepository = marriageRepository;
        this.parentChildRepository = parentChildRepository;
        this.treeStateService = treeStateService;
    }

    public List<Person> listPersons() {
        return personRepository.findAll();
    }

    public Optional<Person> getPerson(String id) {
        return personRepository.findById(id);
    }

    /**
     * Create a new person with the provided fields.
     *
     * @param body map containing name (required), gender, dateOfBirth, dateOfDeath, photoPath, notes, x, y
     * @return the created person with a generated id
     */
    @Transactional
    public Person createPerson(Map<String, Object> body) {
        String name = (String) body.get("name");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }

        Person person = new Person(
            UUID.randomUUID().toString(),
            name,
            (String) body.get("gender"),
            (String) body.get("dateOfBirth"),
            (String) body.get("dateOfDeath"),
            (String) body.get("photoPath"),
            (String) body.get("notes"),
            toDouble(body.get("x"), 0),
            toDouble(body.get("y"), 0)
        );

        treeStateService.recordAction("create_person");
        personRepository.save(person);
        log.info("Created person: {}", person.id());
        return person;
    }

    /**
     * Update an existing person. Only the keys present in {@code body} change.
     *
     * @return the updated person, or empty if not found
     */
    @Transactional
    public Optional<Person> updatePerson(String id, Map<String, Object> body) {
        Person existing = personRepository.findById(id).orElse(null);
        if (existing == null) {
            return Optional.empty();
        }
        if (body.containsKey("name") && (body.get("name") == null || ((String) body.get("name")).isBlank())) {
            throw new IllegalArgumentException("name must not be blank");
        }

        Person updated = new Person(
            id,
            stringField(body, "name", existing.name()),
            stringField(body, "gender", existing.gender()),
            stringField(body, "dateOfBirth", existing.dateOfBirth()),
            stringField(body, "dateOfDeath", existing.dateOfDeath()),
            stringField(body, "photoPath", existing.photoPath()),
            stringField(body, "notes", existing.notes()),
            body.containsKey("x") ? toDouble(body.get("x"), existing.x()) : existing.x(),
            body.containsKey("y") ? toDouble(body.get("y"), existing.y()) : existing.y()
        );

        treeStateService.recordAction("update_person");
        personRepository.update(updated);
        log.info("Updated person: {}", id);
        return Optional.of(updated);
    }

    /**
     * Move a person. Dragging produces many of these, so no history entry is recorded.
     */
    public Optional<Person> updatePosition(String id, double x, double y) {
        if (!personRepository.updatePosition(id, x, y)) {
            return Optional.empty();
        }
        return personRepository.findById(id);
    }

    /**
     * Move several persons at once; entries naming unknown ids are skipped.
     *
     * @param positions entries with id, x and y
     * @return the number of persons moved
     */
    @Transactional
    public int updatePositions(List<Map<String, Object>> positions) {
        int count = 0;
        for (Map<String, Object> position : positions) {
            Object id = position.get("id");
            if (id == null) {
                continue;
            }
            if (personRepository.updatePosition(id.toString(),
                    toDouble(position.get("x"), 0), toDouble(position.get("y"), 0))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Delete a person together with their marriages and parent-child links.
     *
     * @return false if the person does not exist
     */
    @Transactional
    public boolean deletePerson(String id) {
        if (!personRepository.existsById(id)) {
            return false;
        }

        treeStateService.recordAction("delete_person");
        int marriages = marriageRepository.deleteByPerson(id);
        int links = parentChildRepository.deleteByPerson(id);
        personRepository.delete(id);
        log.info("Deleted person: {} ({} marriages, {} parent-child links)", id, marriages, links);
        return true;
    }

    private String stringField(Map<String, Object> body, String key, String current) {
        return body.containsKey(key) ? (String) body.get(key) : current;
    }

    private double toDouble(Object value, double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + text, e);
            }
        }
        return fallback;
    }
}
