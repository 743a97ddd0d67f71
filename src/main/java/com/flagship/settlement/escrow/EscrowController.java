package com.flagship.settlement.escrow;

import com.flagship.settlement.escrow.dto.EscrowActionRequest;
import com.flagship.settlement.escrow.dto.EscrowResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Escrow lookup, release and dispute. The caller identifies itself with
 * {@code actor_id}; who that is gets established by the authenticating gateway.
 */
@RestController
@RequestMapping("/api/escrows")
@RequiredArgsConstructor
@Slf4j
public class EscrowController {

    private final EscrowManager escrowManager;

    @GetMapping("/{id}")
    public EscrowResponse getEscrow(@PathVariable("id") UUID escrowId,
                                    @RequestParam("actor_id") UUID actorId) {
        return EscrowResponse.from(escrowManager.getVisibleTo(escrowId, actorId));
    }

    @PostMapping("/{id}/release")
    public EscrowResponse release(@PathVariable("id") UUID escrowId,
                                  @Valid @RequestBody EscrowActionRequest request) {
        log.info("Escrow release requested: escrowId={}, actorId={}", escrowId, request.getActorId());
        return EscrowResponse.from(escrowManager.release(escrowId, request.getActorId()));
    }

    @PostMapping("/{id}/dispute")
    public EscrowResponse dispute(@PathVariable("id") UUID escrowId,
                                  @Valid @RequestBody EscrowActionRequest request) {
        log.info("Escrow dispute requested: escrowId={}, actorId={}", escrowId, request.getActorId());
        return EscrowResponse.from(escrowManager.openDispute(escrowId, request.getActorId()));
    }
}
