package com.familygraph.service;

import com.familygraph.config.FamilyGraphConfig;
import com.familygraph.model.FamilyTree;
import com.familygraph.model.Marriage;
import com.familygraph.model.ParentChild;
import com.familygraph.model.Person;
import com.familygraph.repository.MarriageRepository;
import com.familygraph.repository.ParentChildRepository;
import com.familygraph.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Whole-tree operations on the store: snapshots, bulk replacement and the
 * undo/redo history. History entries are full snapshots kept in memory.
 *
 * <p>A transaction that touches the history holds the history lock from its
 * first history change until it completes, so history-changing transactions
 * run one at a time and each snapshot sees the previous one committed. If the
 * transaction rolls back, the history is restored to what it was before.
 * Writes that record no history (position updates) are not serialized.
 */
@Service
public class TreeStateService {

    private static final Logger log = LoggerFactory.getLogger(TreeStateService.class);

    private final PersonRepository personRepository;
    private final MarriageRepository marriageRepository;
    private final ParentChildRepository parentChildRepository;
    private final int maxHistory;

    private final ReentrantLock historyLock = new ReentrantLock();

    // guarded by historyLock
    private final Deque<HistoryEntry> undoStack = new ArrayDeque<>();
    private final Deque<HistoryEntry> redoStack = new ArrayDeque<>();

    public TreeStateService(PersonRepository personRepository,
                            MarriageRepository marriageRepository,
                            ParentChildRepository parentChildRepository,
                            FamilyGraphConfig config) {
        this.personRepository = personRepository;
        this.marriageRepository = marriageRepository;
        this.parentChildRepository = parentChildRepository;
        this.maxHistory = Math.max(1, config.getHistory().getMaxSize());
    }

    /**
     * Read the whole tree from the store.
     */
    public FamilyTree snapshot() {
        Map<String, Person> persons = new LinkedHashMap<>();
        for (Person person : personRepository.findAll()) {
            persons.put(person.id(), person);
        }
        Map<String, Marriage> marriages = new LinkedHashMap<>();
        for (Marriage marriage : marriageRepository.findAll()) {
            marriages.put(marriage.id(), marriage);
        }
        return new FamilyTree(persons, marriages, parentChildRepository.findAll(), Map.of());
    }

    /**
     * Remember the current tree so the action about to be applied can be undone.
     * Clears the redo history. Call before changing any rows.
     */
    public void recordAction(String action) {
        withHistory(() -> {
            undoStack.push(new HistoryEntry(action, snapshot()));
            while (undoStack.size() > maxHistory) {
                undoStack.removeLast();
            }
            redoStack.clear();
            return null;
        });
    }

    @Transactional
    public boolean undo() {
        return withHistory(() -> swap(undoStack, redoStack, "Undid"));
    }

    @Transactional
    public boolean redo() {
        return withHistory(() -> swap(redoStack, undoStack, "Redid"));
    }

    public boolean canUndo() {
        historyLock.lock();
        try {
            return !undoStack.isEmpty();
        } finally {
            historyLock.unlock();
        }
    }

    public boolean canRedo() {
        historyLock.lock();
        try {
            return !redoStack.isEmpty();
        } finally {
            historyLock.unlock();
        }
    }

    public void clearHistory() {
        historyLock.lock();
        try {
            undoStack.clear();
            redoStack.clear();
        } finally {
            historyLock.unlock();
        }
    }

    /**
     * Swap the stored tree for {@code tree}. Does not touch the history.
     */
    @Transactional
    public void replace(FamilyTree tree) {
        parentChildRepository.deleteAll();
        marriageRepository.deleteAll();
        personRepository.deleteAll();

        tree.persons().values().forEach(personRepository::save);
        tree.marriages().values().forEach(marriageRepository::save);
        tree.parentChild().forEach(parentChildRepository::save);
    }

    /**
     * Start over with an empty tree; the previous one stays undoable.
     */
    @Transactional
    public void reset() {
        recordAction("new_tree");
        replace(FamilyTree.empty());
        log.info("Created new tree");
    }

    private boolean swap(Deque<HistoryEntry> from, Deque<HistoryEntry> to, String verb) {
        if (from.isEmpty()) {
            return false;
        }
        HistoryEntry entry = from.pop();
        to.push(new HistoryEntry(entry.action(), snapshot()));
        replace(entry.tree());
        log.info("{} action: {}", verb, entry.action());
        return true;
    }

    /**
     * Run {@code change} under the history lock. Inside a transaction the lock is
     * kept until the transaction completes and a rollback puts back the stacks
     * as they were when the transaction first took the lock.
     */
    private <T> T withHistory(Supplier<T> change) {
        historyLock.lock();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            try {
                return change.get();
            } finally {
                historyLock.unlock();
            }
        }

        HistoryCheckpoint checkpoint = historyLock.getHoldCount() == 1
                ? new HistoryCheckpoint(List.copyOf(undoStack), List.copyOf(redoStack))
                : null;
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                try {
                    if (checkpoint != null && status != STATUS_COMMITTED) {
                        checkpoint.restore();
                        log.debug("Restored history after rollback");
                    }
                } finally {
                    historyLock.unlock();
                }
            }
        });
        return change.get();
    }

    private record HistoryEntry(String action, FamilyTree tree) {}

    private final class HistoryCheckpoint {
        private final List<HistoryEntry> undo;
        private final List<HistoryEntry> redo;

        private HistoryCheckpoint(List<HistoryEntry> undo, List<HistoryEntry> redo) {
            this.undo = undo;
            this.redo = redo;
        }

        void restore() {
            undoStack.clear();
            undoStack.addAll(undo);
            redoStack.clear();
            redoStack.addAll(redo);
        }
    }
}
