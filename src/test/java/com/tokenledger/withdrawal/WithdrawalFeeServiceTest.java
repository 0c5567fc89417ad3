package com.tokenledger.withdrawal;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InvalidAmountException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WithdrawalFeeServiceTest {

    @Mock
    private WithdrawalFeeRepository feeRepository;

    private WithdrawalFeeService feeService;

    @BeforeEach
    void setUp() {
        feeService = new WithdrawalFeeService(feeRepository, "0.4");
    }

    @Test
    void testCurrentFee_DefaultsToConfiguredValueWithoutWriting() {
        when(feeRepository.findById(1L)).thenReturn(Optional.empty());

        assertEquals(Money.of("0.4", Currency.USDT), feeService.currentFee());
        verify(feeRepository, never()).save(any());
    }

    @Test
    void testCurrentFee_ReadsStoredValue() {
        when(feeRepository.findById(1L)).thenReturn(Optional.of(new WithdrawalFee(new BigDecimal("1.500000"))));

        assertEquals(Money.of("1.5", Currency.USDT), feeService.currentFee());
    }

    @Test
    void testUpdateFee_PersistsSingletonRow() {
        when(feeRepository.findById(1L)).thenReturn(Optional.empty());
        when(feeRepository.save(any(WithdrawalFee.class))).thenAnswer(invocation -> invocation.getArgument(0));

        WithdrawalFee updated = feeService.updateFee(Money.of("0.75", Currency.USDT));

        ArgumentCaptor<WithdrawalFee> saved = ArgumentCaptor.forClass(WithdrawalFee.class);
        verify(feeRepository).save(saved.capture());
        assertEquals(1L, saved.getValue().getId());
        assertEquals(new BigDecimal("0.750000"), updated.getFee());
        assertNotNull(updated.getUpdatedAt());
    }

    @Test
    void testUpdateFee_RejectsNonPositiveOrFiat() {
        assertThrows(InvalidAmountException.class, () -> feeService.updateFee(Money.zero(Currency.USDT)));
        assertThrows(InvalidAmountException.class, () -> feeService.updateFee(Money.of("-1", Currency.USDT)));
        assertThrows(InvalidAmountException.class, () -> feeService.updateFee(Money.of("1", Currency.USD)));
        verifyNoInteractions(feeRepository);
    }

    @Test
    void testConstructor_RejectsMalformedDefault() {
        assertThrows(InvalidAmountException.class, () -> new WithdrawalFeeService(feeRepository, "4e-1"));
    }
}
