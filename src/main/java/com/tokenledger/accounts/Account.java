package com.tokenledger.accounts;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A registered account holder.
 *
 * Accounts never store money. The spendable balance is always derived from the
 * account's transaction records (see {@link com.tokenledger.ledger.BalanceEngine}).
 * Created on first interaction, never deleted.
 */
@Entity
@Table(name = "accounts")
@Data
@NoArgsConstructor
public class Account {

    /**
     * External identifier supplied by the front-end (e.g. a chat id).
     */
    @Id
    private String accountId;

    private String displayName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    public Account(String accountId, String displayName) {
        this.accountId = accountId;
        this.displayName = displayName;
        this.createdAt = Instant.now();
        this.lastActivityAt = this.createdAt;
    }

    /**
     * Record activity, refreshing the display name when a new non-blank one is supplied.
     */
    public void touch(String newDisplayName) {
        if (newDisplayName != null && !newDisplayName.isBlank() && !newDisplayName.equals(displayName)) {
            this.displayName = newDisplayName;
        }
        this.lastActivityAt = Instant.now();
    }
}
