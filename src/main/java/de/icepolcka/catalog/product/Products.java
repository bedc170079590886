package de.icepolcka.catalog.product;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.parser.DatasetLoader;
import de.icepolcka.catalog.parser.FileParser;
import de.icepolcka.catalog.parser.KindRule;

import java.util.regex.Pattern;

/**
 * File-kind tables and query schemas of the IcePolCKa data products.
 * Parsers and loaders are supplied by the caller since they wrap external format libraries.
 */
public final class Products {

    public static final String WRF = "WRF";
    public static final String CRSIM = "CRSIM";
    public static final String RADAR_FILTER = "RF";
    public static final String REGULAR_GRID = "RG";
    public static final String TEMPERATURE = "TEMP";
    public static final String HYDROMETEOR_CLASSIFICATION = "HMC";
    public static final String DWD = "DWD";

    /** WRF output names carry their time stamp: {@code wrfout_d03_2019-07-01_120000}. */
    static final Pattern WRF_FILE_NAME = Pattern.compile("[^_]+_[^_]*_\\d{4}-\\d{2}-\\d{2}_\\d{6}(_.*)?");

    private Products() {
        // Utility class
    }

    /**
     * WRF model output. clouds, wrfmp and wrfout files of one time step form one dataset.
     */
    public static <D> ProductDefinition<D> wrf(FileParser parser, DatasetLoader<D> loader) {
        return ProductDefinition.builder(WRF, parser, loader)
                .kind(KindRule.prefix("clouds", "clouds").requiring(WRF_FILE_NAME))
                .kind(KindRule.prefix("wrfmp", "wrfmp").requiring(WRF_FILE_NAME))
                .kind(KindRule.prefix("wrfout", "wrfout").requiring(WRF_FILE_NAME))
                .filterable(Attribute.DOMAIN, Attribute.PARAMETER_ID, Attribute.MODEL)
                .rangeMode(RangeMode.CONTAINED)
                .referenceData(ReferenceData.icepolcka())
                .build();
    }

    /**
     * CR-SIM radar forward simulations, one file per radar, scheme and hydrometeor class.
     */
    public static <D> ProductDefinition<D> crsim(FileParser parser, DatasetLoader<D> loader) {
        return netCdf(CRSIM, parser, loader)
                .filterable(Attribute.PARAMETER_ID, Attribute.HYDROMETEOR, Attribute.RADAR)
                .build();
    }

    public static <D> ProductDefinition<D> radarFilter(FileParser parser, DatasetLoader<D> loader) {
        return netCdf(RADAR_FILTER, parser, loader)
                .filterable(Attribute.PARAMETER_ID, Attribute.RADAR)
                .build();
    }

    /**
     * Simulated or observed radar data interpolated to the regular grid.
     */
    public static <D> ProductDefinition<D> regularGrid(FileParser parser, DatasetLoader<D> loader) {
        return netCdf(REGULAR_GRID, parser, loader)
                .filterable(Attribute.SOURCE, Attribute.PARAMETER_ID, Attribute.RADAR)
                .build();
    }

    public static <D> ProductDefinition<D> temperature(FileParser parser, DatasetLoader<D> loader) {
        return netCdf(TEMPERATURE, parser, loader)
                .filterable(Attribute.PARAMETER_ID)
                .build();
    }

    public static <D> ProductDefinition<D> hydrometeorClassification(FileParser parser, DatasetLoader<D> loader) {
        return netCdf(HYDROMETEOR_CLASSIFICATION, parser, loader)
                .filterable(Attribute.SOURCE, Attribute.PARAMETER_ID, Attribute.METHOD)
                .build();
    }

    /**
     * DWD C-band volume scans. The 2019-05-28 archive file is known to be broken and is never indexed.
     */
    public static <D> ProductDefinition<D> dwd(FileParser parser, DatasetLoader<D> loader) {
        return ProductDefinition.builder(DWD, parser, loader)
                .kind(KindRule.suffix("hdf5", ".hd5"))
                .exclude("*20190528.hd5")
                .referenceData(ReferenceData.icepolcka())
                .build();
    }

    private static <D> ProductDefinition.Builder<D> netCdf(String name, FileParser parser, DatasetLoader<D> loader) {
        return ProductDefinition.builder(name, parser, loader)
                .kind(KindRule.suffix("nc", ".nc"))
                .referenceData(ReferenceData.icepolcka());
    }
}
