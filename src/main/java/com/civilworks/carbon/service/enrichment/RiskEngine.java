package com.civilworks.carbon.service.enrichment;

import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.model.MaterialProfile;
import com.civilworks.carbon.model.PqeStatus;
import com.civilworks.carbon.model.RiskCategory;
import com.civilworks.carbon.model.RiskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Embodied-carbon screening of contracts.
 *
 * <h3>Per contract</h3>
 * <ol>
 *   <li>Spend from {@code value_amount} via {@link SpendParser}</li>
 *   <li>Below the minimum spend: {@code SKIPPED_LOW_VALUE}</li>
 *   <li>Material from title + description via {@link MaterialMatcher}; none: {@code SKIPPED_NO_REF}</li>
 *   <li>Price or carbon factor missing or not positive: {@code SKIPPED_INVALID_REF}</li>
 *   <li>Otherwise tonnes = spend / price, CO2e t = tonnes * factor / 1000, range +/-25%,
 *       tier from {@link RiskCategory#forCo2eTonnes(double)}: {@code CALCULATED}</li>
 * </ol>
 *
 * <p>Every input contract yields exactly one {@link RiskRecord}; reference gaps are reported
 * through the status, never thrown.
 */
@Service
public class RiskEngine {
    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    static final double RANGE_LOW = 0.75;
    static final double RANGE_HIGH = 1.25;

    private final MaterialMatcher materialMatcher;
    private final double minSpend;

    public RiskEngine(MaterialMatcher materialMatcher, AppProperties appProperties) {
        this.materialMatcher = materialMatcher;
        this.minSpend = appProperties.getScreening().getMinSpend();
    }

    /** Screens every contract and returns the records ordered by estimated CO2e, largest first. */
    public List<RiskRecord> screen(List<ContractRecord> contracts, List<MaterialProfile> materials) {
        List<RiskRecord> results = new ArrayList<>(contracts.size());
        Map<PqeStatus, Integer> tally = new EnumMap<>(PqeStatus.class);
        for (ContractRecord c : contracts) {
            RiskRecord r = assess(c, materials);
            tally.merge(r.getStatus(), 1, Integer::sum);
            results.add(r);
        }
        // List.sort is stable: skipped rows keep their input order at the tail
        results.sort(RiskRecord.BY_CO2E_DESC);
        log.info("Screened {} contracts: {}", contracts.size(), tally);
        return results;
    }

    public RiskRecord assess(ContractRecord contract, List<MaterialProfile> materials) {
        double spend = SpendParser.parse(contract.getValue_amount());
        if (spend < minSpend) {
            return RiskRecord.lowValue(contract);
        }

        Optional<MaterialProfile> match = materialMatcher.match(contract.screeningText(), materials);
        if (match.isEmpty()) {
            return RiskRecord.noReference(contract);
        }
        MaterialProfile material = match.get();

        Double price = material.getPrice_per_tonne();
        Double factor = material.getCarbon_factor_kg_co2e_per_tonne();
        if (price == null || factor == null || price <= 0 || factor <= 0) {
            log.debug("Reference row {} has unusable price={} factor={} (contract {})",
                    material.getMaterial_id(), material.getRaw_price(), material.getRaw_carbon_factor(), contract.getOcid());
            return RiskRecord.invalidReference(contract, material);
        }

        double tonnes = spend / price;
        double co2e = (tonnes * factor) / 1000.0;
        RiskRecord.CarbonEstimate estimate = new RiskRecord.CarbonEstimate(
                material.getMaterial_id(),
                material.getMaterial_name(),
                price,
                factor,
                round2(tonnes),
                round2(co2e),
                round2(co2e * RANGE_LOW),
                round2(co2e * RANGE_HIGH),
                RiskCategory.forCo2eTonnes(co2e),
                material.getSource_reference());
        return RiskRecord.calculated(contract, estimate);
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
