package com.tokenledger.accounts;

import com.tokenledger.common.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Service for managing accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    /**
     * Find an account, creating it on first interaction.
     */
    @Transactional
    public Account findOrCreate(String accountId, String displayName) {
        Optional<Account> existing = accountRepository.findByAccountId(accountId);
        if (existing.isPresent()) {
            Account account = existing.get();
            account.touch(displayName);
            return accountRepository.save(account);
        }

        Account account = accountRepository.save(new Account(accountId, displayName));
        log.info("Registered account {} ({})", accountId, displayName);
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findByAccountId(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Lock the account row until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account lockAccount(String accountId) {
        return accountRepository.findForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }
}
