package com.tokenledger.accounts;

import com.tokenledger.common.exception.AccountNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @InjectMocks
    private AccountService accountService;

    @Test
    void testFindOrCreate_RegistersNewAccount() {
        when(accountRepository.findByAccountId("chat-1")).thenReturn(Optional.empty());
        when(accountRepository.save(any(Account.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Account account = accountService.findOrCreate("chat-1", "Alice");

        assertEquals("chat-1", account.getAccountId());
        assertEquals("Alice", account.getDisplayName());
        assertNotNull(account.getCreatedAt());
    }

    @Test
    void testFindOrCreate_RefreshesDisplayName() {
        Account existing = new Account("chat-1", "Alice");
        when(accountRepository.findByAccountId("chat-1")).thenReturn(Optional.of(existing));
        when(accountRepository.save(existing)).thenReturn(existing);

        assertEquals("Alice B.", accountService.findOrCreate("chat-1", "Alice B.").getDisplayName());
        assertEquals("Alice B.", accountService.findOrCreate("chat-1", " ").getDisplayName());
        verify(accountRepository, times(2)).save(existing);
    }

    @Test
    void testGetAccount_NotFound() {
        when(accountRepository.findByAccountId("missing")).thenReturn(Optional.empty());

        assertThrows(AccountNotFoundException.class, () -> accountService.getAccount("missing"));
    }
}
