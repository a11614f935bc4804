package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.SchemaVersion;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.PayerCharge;
import com.al.pricetransparency.model.mrf.SettingCharge;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.RecordingChargeListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The same prices published as a tall and as a wide file must produce the same items.
 */
public class CsvLayoutEquivalenceTest {

    private static final String METADATA = "hospital_name,version\nAcme General,3.0.0\n";

    private static final String TALL = METADATA
            + "description,code|1,code|1|type,setting,standard_charge|gross,standard_charge|discounted_cash,"
            + "payer_name,plan_name,standard_charge|negotiated_dollar,standard_charge|negotiated_percentage,"
            + "standard_charge|methodology\n"
            + "MRI Brain w/o Contrast,70551,CPT,outpatient,4000,2500,Acme Health,PPO,1800,,fee schedule\n"
            + "MRI Brain w/o Contrast,70551,CPT,outpatient,4000,2500,Blue Plan,HMO,,55,percent of total billed charges\n"
            + "Chest X-ray,71046,CPT,outpatient,300,150,Acme Health,PPO,120,,fee schedule\n";

    private static final String WIDE = METADATA
            + "description,code|1,code|1|type,setting,standard_charge|gross,standard_charge|discounted_cash,"
            + "standard_charge|Acme Health|PPO|negotiated_dollar,standard_charge|Acme Health|PPO|methodology,"
            + "standard_charge|Blue Plan|HMO|negotiated_percentage,standard_charge|Blue Plan|HMO|methodology\n"
            + "MRI Brain w/o Contrast,70551,CPT,outpatient,4000,2500,1800,fee schedule,55,percent of total billed charges\n"
            + "Chest X-ray,71046,CPT,outpatient,300,150,120,fee schedule,,\n";

    @TempDir
    Path tempDir;

    @Test
    public void testTallAndWideProduceEquivalentItems() throws Exception {
        RecordingChargeListener tall = new RecordingChargeListener();
        new CsvTallChargeParser().parse(file("tall.csv", TALL, FileFormat.CSV_TALL), tall, ParseOptions.defaults());
        RecordingChargeListener wide = new RecordingChargeListener();
        new CsvWideChargeParser().parse(file("wide.csv", WIDE, FileFormat.CSV_WIDE), wide, ParseOptions.defaults());

        assertEquals(2, tall.items.size());
        assertEquals(summarize(tall.items), summarize(wide.items));
    }

    private static List<String> summarize(List<ChargeItem> items) {
        List<String> lines = new ArrayList<>();
        for (ChargeItem item : items) {
            String codes = item.getCodes().stream()
                    .map(c -> c.getCode() + ":" + c.getType())
                    .collect(Collectors.joining(","));
            for (SettingCharge charge : item.getSettingCharges()) {
                String payers = charge.getPayerCharges().stream()
                        .map(CsvLayoutEquivalenceTest::summarize)
                        .sorted()
                        .collect(Collectors.joining(";"));
                lines.add(item.getDescription() + "|" + codes + "|" + charge.getSetting() + "|"
                        + charge.getGrossCharge() + "|" + charge.getDiscountedCashPrice() + "|" + payers);
            }
        }
        return lines;
    }

    private static String summarize(PayerCharge payer) {
        return payer.getPayerName() + "/" + payer.getPlanName() + "/" + payer.getDollarAmount() + "/"
                + payer.getPercentage() + "/" + payer.getMethodology();
    }

    private FileMetadata file(String name, String content, FileFormat format) throws Exception {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content);
        return FileMetadata.builder()
                .path(path)
                .format(format)
                .version(SchemaVersion.V3)
                .rawVersion("3.0.0")
                .sizeBytes(Files.size(path))
                .build();
    }
}
