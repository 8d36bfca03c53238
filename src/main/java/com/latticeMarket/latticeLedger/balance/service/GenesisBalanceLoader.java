package com.latticeMarket.latticeLedger.balance.service;

import com.latticeMarket.latticeLedger.balance.dto.GenesisBalance;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import com.latticeMarket.latticeLedger.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Seeds the in-memory balance ledger with opening balances at startup.
 * A missing genesis file leaves every account at zero.
 */
@Slf4j
@Component
public class GenesisBalanceLoader implements ApplicationRunner {

    private final InMemoryBalanceLedger balanceLedger;
    private final String genesisFile;

    public GenesisBalanceLoader(
            InMemoryBalanceLedger balanceLedger,
            @Value("${ledger.balances.genesis-file:data/genesis-balances.json}") String genesisFile) {
        this.balanceLedger = balanceLedger;
        this.genesisFile = genesisFile;
    }

    @Override
    public void run(ApplicationArguments args) {
        load();
    }

    /**
     * @return number of accounts credited
     */
    public int load() {
        if (!JsonFileLoader.exists(genesisFile)) {
            log.info("No genesis balance file at {} - starting with empty balances", genesisFile);
            return 0;
        }
        List<GenesisBalance> entries;
        try {
            entries = JsonFileLoader.loadAsList(genesisFile, GenesisBalance.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read genesis balances from " + genesisFile, e);
        }
        for (GenesisBalance entry : entries) {
            if (entry.getAccount() == null || entry.getAccount().isBlank() || entry.getAmount() < 0) {
                throw new IllegalStateException("Invalid genesis balance entry: " + entry);
            }
            balanceLedger.credit(entry.getAccount().trim(), entry.getAmount());
            log.debug("Genesis credit - account: {}, amount: {}",
                    AccountIdMasker.mask(entry.getAccount()), entry.getAmount());
        }
        log.info("Loaded {} genesis balances from {}", entries.size(), genesisFile);
        return entries.size();
    }
}
