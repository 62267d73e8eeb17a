package com.familygraph.service;

import com.familygraph.model.Marriage;
import com.familygraph.model.ParentChild;
import com.familygraph.repository.MarriageRepository;
import com.familygraph.repository.ParentChildRepository;
import com.familygraph.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Marriages and parent-child links. Unlike the layout engine, this is where
 * referenced persons and marriages are checked to exist.
 */
@Service
public class RelationshipService {

    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    private final PersonRepository personRepository;
    private final MarriageRepository marriageRepository;
    private final ParentChildRepository parentChildRepository;
    private final TreeStateService treeStateService;

    public RelationshipService(PersonRepository personRepository,
                               MarriageRepository marriageRepository,
                               ParentChildRepository parentChildRepository,
                               TreeStateService treeStateService) {
        this.personRepository = personRepository;
        this.marriageRepository = marriageRepository;
        this.parentChildRepository = parentChildRepository;
        this.treeStateService = treeStateService;
    }

    // ========== MARRIAGES ==========

    /**
     * Marry two existing persons. The marriage is ranked after every marriage
     * either spouse already has.
     *
     * @throws NoSuchElementException if either spouse does not exist
     */
    @Transactional
    public Marriage createMarriage(String spouse1Id, String spouse2Id, String marriageDate) {
        if (spouse1Id == null || !personRepository.existsById(spouse1Id)) {
            throw new NoSuchElementException("Spouse 1 not found");
        }
        if (spouse2Id == null || !personRepository.existsById(spouse2Id)) {
            throw new NoSuchElementException("Spouse 2 not found");
        }

        int order = marriageRepository.countInvolving(spouse1Id, spouse2Id) + 1;

        treeStateService.recordAction("create_marriage");
        Marriage marriage = new Marriage(UUID.randomUUID().toString(), spouse1Id, spouse2Id, marriageDate, order);
        marriageRepository.save(marriage);
        log.info("Created marriage: {}", marriage.id());
        return marriage;
    }

    public List<Marriage> listMarriages() {
        return marriageRepository.findAll();
    }

    /**
     * Delete a marriage and every parent-child link recorded against it.
     *
     * @throws NoSuchElementException if the marriage does not exist
     */
    @Transactional
    public void deleteMarriage(String marriageId) {
        if (marriageRepository.findById(marriageId).isEmpty()) {
            throw new NoSuchElementException("Marriage not found");
        }

        treeStateService.recordAction("delete_marriage");
        marriageRepository.delete(marriageId);
        int links = parentChildRepository.deleteByMarriage(marriageId);
        log.info("Deleted marriage: {} ({} parent-child links)", marriageId, links);
    }

    // ========== PARENT-CHILD ==========

    /**
     * Record {@code childId} as a child of {@code parentId}, optionally through a marriage.
     *
     * @throws NoSuchElementException if the parent, child or marriage does not exist
     * @throws IllegalArgumentException if the pair is already linked
     */
    @Transactional
    public ParentChild addChild(String parentId, String childId, String marriageId) {
        if (parentId == null || !personRepository.existsById(parentId)) {
            throw new NoSuchElementException("Parent not found");
        }
        if (childId == null || !personRepository.existsById(childId)) {
            throw new NoSuchElementException("Child not found");
        }
        if (marriageId != null && marriageRepository.findById(marriageId).isEmpty()) {
            throw new NoSuchElementException("Marriage not found");
        }
        if (parentChildRepository.exists(parentId, childId)) {
            throw new IllegalArgumentException("Relationship already exists");
        }

        treeStateService.recordAction("add_child");
        ParentChild relation = new ParentChild(parentId, childId, marriageId);
        parentChildRepository.save(relation);
        log.info("Added child relation: {} -> {}", parentId, childId);
        return relation;
    }

    public List<ParentChild> listParentChild() {
        return parentChildRepository.findAll();
    }

    /**
     * @throws NoSuchElementException if no such link exists
     */
    @Transactional
    public void removeChild(String parentId, String childId) {
        if (!parentChildRepository.exists(parentId, childId)) {
            throw new NoSuchElementException("Relationship not found");
        }

        treeStateService.recordAction("remove_child");
        parentChildRepository.delete(parentId, childId);
        log.info("Removed child relation: {} -> {}", parentId, childId);
    }
}
