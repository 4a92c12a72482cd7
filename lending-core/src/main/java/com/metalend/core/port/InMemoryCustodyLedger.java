package com.metalend.core.port;

import com.metalend.core.exception.TransferFailedException;
import com.metalend.core.model.AssetRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Asset ownership table used when no external custody system is wired in.
 * Every access is serialized on the ledger instance.
 */
@Slf4j
@Component
public class InMemoryCustodyLedger implements CustodyPort {

    public static final String CUSTODIAN = "metalend-custody";

    private final Map<AssetRef, String> holders = new HashMap<>();

    public synchronized void register(AssetRef asset, String holder) {
        holders.put(asset, holder);
    }

    public synchronized Optional<String> holderOf(AssetRef asset) {
        return Optional.ofNullable(holders.get(asset));
    }

    @Override
    public synchronized void takeIntoCustody(String from, AssetRef asset) {
        String holder = holders.get(asset);
        if (holder == null || !holder.equals(from)) {
            throw new TransferFailedException("Asset " + asset + " is not held by " + from);
        }
        holders.put(asset, CUSTODIAN);
        log.debug("Custody taken asset={} from={}", asset, from);
    }

    @Override
    public synchronized void releaseFromCustody(AssetRef asset, String to) {
        if (!CUSTODIAN.equals(holders.get(asset))) {
            throw new TransferFailedException("Asset " + asset + " is not in custody");
        }
        holders.put(asset, to);
        log.debug("Custody released asset={} to={}", asset, to);
    }
}
