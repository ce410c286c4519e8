package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered approval levels for one document type. Levels are sorted by level number.
 */
@Value
public class ApprovalWorkflow {
    UUID id;
    String workflowName;
    String documentType;
    boolean active;
    List<ApprovalLevel> levels;
    String createdBy;
    Instant createdAt;

    /**
     * @throws ValidationException if the levels are empty, not numbered 1.. in strictly
     *         increasing order, or have a malformed band or approver
     */
    public static ApprovalWorkflow define(String workflowName, String documentType, List<ApprovalLevel> levels,
                                          boolean active, String createdBy) {
        if (workflowName == null || workflowName.isBlank()) {
            throw new ValidationException("Workflow name is required");
        }
        if (documentType == null || documentType.isBlank()) {
            throw new ValidationException("Document type is required");
        }
        if (levels == null || levels.isEmpty()) {
            throw new ValidationException("A workflow needs at least one approval level");
        }

        if (levels.contains(null)) {
            throw new ValidationException("Approval levels cannot be empty");
        }

        List<ApprovalLevel> sorted = levels.stream()
            .sorted(Comparator.comparingInt(ApprovalLevel::getLevelNumber))
            .toList();
        int previous = 0;
        for (ApprovalLevel level : sorted) {
            level.validate();
            if (level.getLevelNumber() == previous) {
                throw new ValidationException("Duplicate level number " + previous);
            }
            previous = level.getLevelNumber();
        }
        if (sorted.get(0).getLevelNumber() != 1) {
            throw new ValidationException("Level numbers must start at 1");
        }

        return new ApprovalWorkflow(UUID.randomUUID(), workflowName, documentType, active,
            sorted, createdBy, Instant.now());
    }

    /**
     * Level 1, if it exists and is mandatory. Every request starts there regardless of amount.
     */
    public Optional<ApprovalLevel> firstLevel() {
        return levels.stream()
            .filter(level -> level.getLevelNumber() == 1 && level.isMandatory())
            .findFirst();
    }

    /**
     * The lowest-numbered mandatory level above {@code currentLevel} whose band covers the amount.
     */
    public Optional<ApprovalLevel> nextLevel(int currentLevel, BigDecimal amount) {
        return levels.stream()
            .filter(level -> level.getLevelNumber() > currentLevel)
            .filter(ApprovalLevel::isMandatory)
            .filter(level -> level.covers(amount))
            .findFirst();
    }

    /**
     * True when no mandatory level above {@code currentLevel} covers the amount although
     * at least one of them has a band below it. This covers amounts above every higher
     * band and amounts falling in a hole between two higher bands.
     */
    public boolean missesHigherBand(int currentLevel, BigDecimal amount) {
        List<ApprovalLevel> higher = levels.stream()
            .filter(level -> level.getLevelNumber() > currentLevel)
            .filter(ApprovalLevel::isMandatory)
            .toList();
        return higher.stream().noneMatch(level -> level.covers(amount))
            && higher.stream().anyMatch(level -> level.getMaxAmount().compareTo(amount) < 0);
    }

    public Optional<BigDecimal> highestMandatoryMaxAmount() {
        return levels.stream()
            .filter(ApprovalLevel::isMandatory)
            .map(ApprovalLevel::getMaxAmount)
            .max(Comparator.naturalOrder());
    }

    public Optional<ApprovalLevel> level(int levelNumber) {
        return levels.stream().filter(level -> level.getLevelNumber() == levelNumber).findFirst();
    }
}
