package com.tokenledger;

import com.tokenledger.accounts.AccountService;
import com.tokenledger.chain.BlockchainClient;
import com.tokenledger.chain.Receipt;
import com.tokenledger.chain.TransferEvent;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.ledger.BalanceEngine;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordRepository;
import com.tokenledger.ledger.TransactionRecordStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;

/**
 * Shared Spring context for integration tests. The chain is always a mock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class IntegrationTestBase {

    protected static final String DEPOSIT_ADDRESS = "0x1111111111111111111111111111111111111111";
    protected static final String HOT_WALLET_ADDRESS = "0x2222222222222222222222222222222222222222";
    protected static final String EXTERNAL_ADDRESS = "0x3333333333333333333333333333333333333333";
    protected static final String SENDER_ADDRESS = "0x4444444444444444444444444444444444444444";

    @MockBean
    protected BlockchainClient blockchainClient;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected AccountService accountService;

    @Autowired
    protected TransactionRecordStore recordStore;

    @Autowired
    protected TransactionRecordRepository recordRepository;

    @Autowired
    protected BalanceEngine balanceEngine;

    protected String newAccount() {
        String accountId = "acct-" + UUID.randomUUID();
        accountService.findOrCreate(accountId, "Test Holder");
        return accountId;
    }

    protected TransactionRecord creditDeposit(String accountId, String amount) {
        return recordStore.recordCompletedDeposit(accountId, usdt(amount), randomReference(), 6);
    }

    protected static Money usdt(String amount) {
        return Money.of(amount, Currency.USDT);
    }

    protected static String randomReference() {
        return "0x" + UUID.randomUUID().toString().replace("-", "")
            + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Make the mocked chain report a successful transfer mined at {@code blockNumber}.
     */
    protected Receipt stubTransfer(String reference, long blockNumber, long currentHeight,
                                   String to, String amount) {
        Receipt receipt = Receipt.builder()
            .reference(reference)
            .blockNumber(blockNumber)
            .successful(true)
            .build();

        when(blockchainClient.getReceipt(reference)).thenReturn(Optional.of(receipt));
        when(blockchainClient.currentBlockHeight()).thenReturn(currentHeight);
        when(blockchainClient.parseTransferEvents(receipt))
            .thenReturn(List.of(new TransferEvent(SENDER_ADDRESS, to, new BigDecimal(amount))));

        return receipt;
    }
}
