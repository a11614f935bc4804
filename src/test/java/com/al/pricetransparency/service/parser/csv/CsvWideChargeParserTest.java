package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.Methodology;
import com.al.pricetransparency.model.enums.SchemaVersion;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.PayerCharge;
import com.al.pricetransparency.model.mrf.SettingCharge;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.ParseResult;
import com.al.pricetransparency.service.parser.RecordingChargeListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvWideChargeParserTest {

    private static final String METADATA_V2 = """
            hospital_name,last_updated_on,version
            Acme General,2024-07-01,2.2.0
            """;

    private static final String HEADERS = "description,code|1,code|1|type,setting,standard_charge|gross,"
            + "standard_charge|discounted_cash,standard_charge|min,standard_charge|max,"
            + "standard_charge|Acme Health|PPO|negotiated_dollar,standard_charge|Acme Health|PPO|methodology,"
            + "estimated_amount|Acme Health|PPO,additional_payer_notes|Acme Health|PPO,"
            + "standard_charge|Blue Plan|HMO|negotiated_percentage,standard_charge|Blue Plan|HMO|methodology\n";

    @TempDir
    Path tempDir;

    private final CsvWideChargeParser parser = new CsvWideChargeParser();

    @Test
    public void testParse_OneItemPerRowWithPayersFromHeaders() throws Exception {
        String csv = METADATA_V2 + HEADERS
                + "MRI Brain w/o Contrast,70551,CPT,outpatient,4000,2500,1800,2200,1800,fee schedule,1900,In network only,55,percent of total billed charges\n"
                + "MRI Brain w/o Contrast,70551,CPT,inpatient,5000,3000,2600,2600,2600,fee schedule,,,,\n";
        RecordingChargeListener listener = new RecordingChargeListener();

        ParseResult result = parser.parse(file(csv), listener, ParseOptions.defaults());

        assertEquals(FileFormat.CSV_WIDE, result.getFormat());
        assertEquals(2, result.getChargeCount());
        assertEquals("Acme General", result.getMetadata().getHospitalName());

        ChargeItem outpatientItem = listener.items.get(0);
        assertEquals(1, outpatientItem.getSettingCharges().size());
        SettingCharge outpatient = outpatientItem.getSettingCharges().get(0);
        assertEquals(Setting.OUTPATIENT, outpatient.getSetting());
        assertEquals(4000.0, outpatient.getGrossCharge());
        assertEquals(2500.0, outpatient.getDiscountedCashPrice());
        assertEquals(1800.0, outpatient.getMinNegotiated());
        assertEquals(2200.0, outpatient.getMaxNegotiated());
        assertEquals(2, outpatient.getPayerCharges().size());

        PayerCharge acme = outpatient.getPayerCharges().get(0);
        assertEquals("Acme Health", acme.getPayerName());
        assertEquals("PPO", acme.getPlanName());
        assertEquals(1800.0, acme.getDollarAmount());
        assertEquals(Methodology.FEE_SCHEDULE, acme.getMethodology());
        assertEquals(1900.0, acme.getEstimatedAmount());
        assertEquals("In network only", acme.getNotes());

        PayerCharge blue = outpatient.getPayerCharges().get(1);
        assertEquals("Blue Plan", blue.getPayerName());
        assertEquals("HMO", blue.getPlanName());
        assertEquals(55.0, blue.getPercentage());

        SettingCharge inpatient = listener.items.get(1).getSettingCharges().get(0);
        assertEquals(Setting.INPATIENT, inpatient.getSetting());
        assertEquals(1, inpatient.getPayerCharges().size());
        assertEquals("Acme Health", inpatient.getPayerCharges().get(0).getPayerName());
    }

    @Test
    public void testParse_BlankPayerCellsProduceNoPayer() throws Exception {
        String csv = METADATA_V2 + HEADERS + "Office visit,99213,CPT,outpatient,150,90,,,,,,,,\n";
        RecordingChargeListener listener = new RecordingChargeListener();

        parser.parse(file(csv), listener, ParseOptions.defaults());

        assertTrue(listener.items.get(0).getSettingCharges().get(0).getPayerCharges().isEmpty());
    }

    @Test
    public void testParse_SkipsRowsWithoutDescription() throws Exception {
        String csv = METADATA_V2 + HEADERS + ",99213,CPT,outpatient,150,90,,,,,,,,\n";

        ParseResult result = parser.parse(file(csv), new RecordingChargeListener(), ParseOptions.defaults());

        assertEquals(0, result.getChargeCount());
        assertEquals(1, result.getSkippedCount());
    }

    @Test
    public void testParse_ShortRowsAreTolerated() throws Exception {
        String csv = METADATA_V2 + HEADERS + "Office visit,99213,CPT,outpatient,150\n";
        RecordingChargeListener listener = new RecordingChargeListener();

        ParseResult result = parser.parse(file(csv), listener, ParseOptions.defaults());

        assertEquals(1, result.getChargeCount());
        assertEquals(150.0, listener.items.get(0).getSettingCharges().get(0).getGrossCharge());
    }

    @Test
    public void testDiscoverPayerColumns_BothHeaderLayouts() {
        List<WidePayerColumn> columns = CsvWideChargeParser.discoverPayerColumns(List.of(
                "description",
                "standard_charge|gross",
                "code|1|type",
                "standard_charge|Aetna|Choice POS|negotiated_dollar",
                "median_amount|Cigna|Open Access"));

        assertEquals(2, columns.size());
        assertEquals(3, columns.get(0).getIndex());
        assertEquals("Aetna", columns.get(0).getPayerName());
        assertEquals("Choice POS", columns.get(0).getPlanName());
        assertEquals(PayerField.NEGOTIATED_DOLLAR, columns.get(0).getField());
        assertEquals("Cigna", columns.get(1).getPayerName());
        assertEquals(PayerField.MEDIAN_AMOUNT, columns.get(1).getField());
    }

    @Test
    public void testParse_EmptyPlanSegmentKeepsPayerWithoutPlan() throws Exception {
        String csv = METADATA_V2
                + "description,code|1,code|1|type,setting,standard_charge|gross,"
                + "standard_charge|Aetna||negotiated_dollar,standard_charge|Aetna||methodology\n"
                + "Office visit,99213,CPT,outpatient,150,95,fee schedule\n";
        RecordingChargeListener listener = new RecordingChargeListener();

        parser.parse(file(csv), listener, ParseOptions.defaults());

        List<PayerCharge> payers = listener.items.get(0).getSettingCharges().get(0).getPayerCharges();
        assertEquals(1, payers.size());
        assertEquals("Aetna", payers.get(0).getPayerName());
        assertNull(payers.get(0).getPlanName());
        assertEquals(95.0, payers.get(0).getDollarAmount());
        assertEquals(Methodology.FEE_SCHEDULE, payers.get(0).getMethodology());
    }

    @Test
    public void testDiscoverPayerColumns_EmptyPayerIsIgnored() {
        List<WidePayerColumn> columns = CsvWideChargeParser.discoverPayerColumns(List.of(
                "standard_charge||PPO|negotiated_dollar",
                "standard_charge|Aetna||negotiated_percentage"));

        assertEquals(1, columns.size());
        assertEquals("Aetna", columns.get(0).getPayerName());
        assertNull(columns.get(0).getPlanName());
        assertEquals("Aetna|", columns.get(0).payerKey());
    }

    private FileMetadata file(String content) throws Exception {
        Path path = tempDir.resolve("acme_standardcharges.csv");
        Files.writeString(path, content);
        return FileMetadata.builder()
                .path(path)
                .format(FileFormat.CSV_WIDE)
                .version(SchemaVersion.UNKNOWN)
                .sizeBytes(Files.size(path))
                .build();
    }
}
