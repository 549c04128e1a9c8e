package com.quikdb.api.governance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.config.RewardProperties;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.TimeLockedProposal;
import com.quikdb.core.repository.TimeLockedProposalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Two-phase administration: an admin command is proposed, waits out its
 * delay, and is then executed exactly once.
 *
 * Proposals are addressed by the SHA-256 of the serialized command and its
 * description. A hash can have at most one pending proposal at a time.
 */
@Service
public class TimeLockService {

    private static final Logger log = LoggerFactory.getLogger(TimeLockService.class);

    private final TimeLockedProposalRepository proposalRepository;
    private final AdminCommandExecutor commandExecutor;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final RewardProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TimeLockService(
            TimeLockedProposalRepository proposalRepository,
            AdminCommandExecutor commandExecutor,
            AccessPolicy accessPolicy,
            AuditService auditService,
            RewardProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.proposalRepository = proposalRepository;
        this.commandExecutor = commandExecutor;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return the operation hash addressing the proposal
     */
    @Transactional
    public String propose(String caller, AdminCommand command, long delaySeconds, String description) {
        accessPolicy.require(caller, Capability.ADMIN);
        if (command == null) {
            throw RewardException.validation("Command is required");
        }
        if (description == null || description.isBlank()) {
            throw RewardException.validation("Description is required");
        }
        RewardProperties.TimeLock bounds = properties.getTimelock();
        if (delaySeconds < bounds.getMinDelaySeconds() || delaySeconds > bounds.getMaxDelaySeconds()) {
            throw RewardException.validation("Delay " + delaySeconds + "s outside ["
                    + bounds.getMinDelaySeconds() + ", " + bounds.getMaxDelaySeconds() + "]");
        }

        String payload = serialize(command);
        String operationHash = operationHash(payload, description);
        if (proposalRepository.findPending(operationHash).isPresent()) {
            throw RewardException.precondition("Operation already proposed: " + operationHash);
        }

        Instant now = clock.instant();
        TimeLockedProposal proposal = proposalRepository.save(TimeLockedProposal.propose(
                operationHash, command.getClass().getSimpleName(), payload, description,
                caller, now, delaySeconds));
        auditService.record(EventType.TIMELOCK_PROPOSED, caller, operationHash, null,
                proposal.getExecuteAfter(), description);
        log.info("Proposed {} as {} by {}, executable after {}",
                proposal.getCommandType(), operationHash, caller, proposal.getExecuteAfter());
        return operationHash;
    }

    @Transactional
    public AdminCommand execute(String caller, String operationHash) {
        accessPolicy.require(caller, Capability.ADMIN);
        TimeLockedProposal proposal = proposalRepository.findPending(operationHash)
                .orElseThrow(() -> missingProposal(operationHash));
        Instant now = clock.instant();
        if (!proposal.isReady(now)) {
            log.warn("Early execution of {} by {} rejected, executable after {}",
                    operationHash, caller, proposal.getExecuteAfter());
            throw RewardException.precondition("Time lock not expired until " + proposal.getExecuteAfter());
        }

        AdminCommand command = deserialize(proposal.getCommandPayload());
        commandExecutor.execute(command, caller);
        proposal.markExecuted(caller, now);
        proposalRepository.save(proposal);
        auditService.record(EventType.TIMELOCK_EXECUTED, caller, operationHash, "pending", "executed",
                proposal.getCommandType());
        log.info("Executed {} ({}) by {}", operationHash, proposal.getCommandType(), caller);
        return command;
    }

    @Transactional
    public void cancel(String caller, String operationHash) {
        accessPolicy.require(caller, Capability.ADMIN);
        TimeLockedProposal proposal = proposalRepository.findPending(operationHash)
                .orElseThrow(() -> missingProposal(operationHash));
        proposal.cancel();
        proposalRepository.save(proposal);
        auditService.record(EventType.TIMELOCK_CANCELLED, caller, operationHash, "pending", "cancelled",
                proposal.getCommandType());
        log.info("Cancelled {} by {}", operationHash, caller);
    }

    @Transactional(readOnly = true)
    public List<TimeLockedProposal> pendingProposals() {
        return proposalRepository.findByExecutedFalseAndCancelledFalseOrderByExecuteAfterAsc();
    }

    @Transactional(readOnly = true)
    public List<TimeLockedProposal> history(String operationHash) {
        return proposalRepository.findByOperationHashOrderByProposedAtDesc(operationHash);
    }

    private RewardException missingProposal(String operationHash) {
        boolean executed = proposalRepository.findByOperationHashOrderByProposedAtDesc(operationHash).stream()
                .anyMatch(TimeLockedProposal::isExecuted);
        return executed
                ? RewardException.precondition("Operation already executed: " + operationHash)
                : RewardException.precondition("No pending proposal: " + operationHash);
    }

    private String serialize(AdminCommand command) {
        try {
            return objectMapper.writerFor(AdminCommand.class).writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize admin command", e);
        }
    }

    private AdminCommand deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, AdminCommand.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored admin command", e);
        }
    }

    static String operationHash(String payload, String description) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((payload + "|" + description).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
