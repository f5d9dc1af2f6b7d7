package com.auditeng.backend.model;

/**
 * Semantic field names shared by extractors, the consistency validator and the rules engine.
 */
public final class FieldNames {

    public static final String EQUIPMENT_TAG = "equipment_tag";
    public static final String EQUIPMENT_SERIAL = "equipment_serial";
    public static final String EQUIPMENT_TYPE = "equipment_type";
    public static final String EQUIPMENT_LOCATION = "equipment_location";

    public static final String INSTRUMENT_SERIAL = "instrument_serial";
    public static final String INSTRUMENT_MODEL = "instrument_model";
    public static final String CERTIFICATE_NUMBER = "certificate_number";
    public static final String CALIBRATION_DATE = "calibration_date";
    public static final String CALIBRATION_EXPIRY_DATE = "calibration_expiry_date";
    public static final String CALIBRATION_LAB = "calibration_lab";

    public static final String MEASUREMENT_DATE = "measurement_date";
    public static final String TECHNICIAN_NAME = "technician_name";
    public static final String TECHNICIAN_SIGNATURE_PRESENT = "technician_signature_present";
    public static final String PHOTO_WATERMARK_PRESENT = "photo_watermark_present";

    public static final String DISPLAY_VALUE = "display_value";
    public static final String DISPLAY_UNIT = "display_unit";
    public static final String TABLE_VALUE = "table_value";
    public static final String TABLE_EQUIPMENT_TAG = "table_equipment_tag";

    public static final String GROUND_RESISTANCE = "ground_resistance";

    public static final String ABSORPTION_INDEX = "absorption_index";
    public static final String POLARIZATION_INDEX = "polarization_index";
    public static final String TEST_VOLTAGE = "test_voltage";

    public static final String AMBIENT_TEMPERATURE = "ambient_temperature";
    public static final String REFLECTED_TEMPERATURE = "reflected_temperature";
    public static final String EMISSIVITY = "emissivity";
    public static final String MAX_TEMPERATURE = "max_temperature";
    public static final String MIN_TEMPERATURE = "min_temperature";
    public static final String DELTA_T = "delta_t";
    public static final String PHASE_DELTA_T = "phase_delta_t";
    public static final String LOAD_CURRENT = "load_current";
    public static final String LOAD_PERCENT = "load_percent";

    private static final String INSULATION_RESISTANCE_PREFIX = "insulation_resistance_";

    private FieldNames() {
    }

    /**
     * Field holding the insulation resistance in megohms for one phase combination, e.g. {@code insulation_resistance_A-B}.
     */
    public static String insulationResistance(String combination) {
        return INSULATION_RESISTANCE_PREFIX + combination;
    }
}
