package com.metalend.core.port;

import com.metalend.core.config.LendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default authorization collaborator: a role table seeded from configuration and maintained by admins.
 */
@Slf4j
@Component
public class RoleRegistry implements AuthorizationPort {

    private final Map<String, Set<Role>> roles = new ConcurrentHashMap<>();

    public RoleRegistry(LendingProperties properties) {
        LendingProperties.Security security = properties.getSecurity();
        security.getAdmins().forEach(party -> add(party, Role.ADMIN));
        security.getPriceUpdaters().forEach(party -> add(party, Role.PRICE_UPDATER));
        add(security.getPoolIdentity(), Role.LENDING_POOL);
        add(security.getEngineIdentity(), Role.LIQUIDATION_ENGINE);
    }

    @Override
    public boolean hasRole(String party, Role role) {
        Set<Role> granted = roles.get(party);
        return granted != null && granted.contains(role);
    }

    public void grant(String caller, String party, Role role) {
        require(caller, Role.ADMIN);
        add(party, role);
        log.info("Role granted party={} role={} by={}", party, role, caller);
    }

    public void revoke(String caller, String party, Role role) {
        require(caller, Role.ADMIN);
        Set<Role> granted = roles.get(party);
        if (granted != null) {
            granted.remove(role);
        }
        log.info("Role revoked party={} role={} by={}", party, role, caller);
    }

    private void add(String party, Role role) {
        roles.computeIfAbsent(party, key -> EnumSet.noneOf(Role.class)).add(role);
    }
}
