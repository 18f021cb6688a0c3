// ******************************************************************************
//
// Title:       RBX.
// Description: RBX - Rigid-Body constraint eXchange for SHELXL and CIF.
// Copyright:   Copyright (c) RBX developers 2023.
//
// This file is part of RBX.
//
// RBX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// RBX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// RBX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package rbx.utilities;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The RBXProperties class assembles the configuration used by the AFIX and CIF converters and
 * names the keys they read.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class RBXProperties {

    private static final Logger logger = Logger.getLogger(RBXProperties.class.getName());

    /**
     * Width at which instruction lines are wrapped with the SHELXL " =" continuation.
     */
    public static final String INS_LINE_WIDTH = "ins-line-width";
    /**
     * Occupancy written for atom lines rebuilt from CIF records.
     */
    public static final String INS_OCCUPANCY = "ins-occupancy";
    /**
     * Number of decimals used for the Uiso multiplier column.
     */
    public static final String UISO_MULTIPLIER_DECIMALS = "uiso-multiplier-decimals";
    /**
     * Keep the embedded instruction text even when every instruction is representable.
     */
    public static final String KEEP_INSTRUCTIONS = "keep-instructions";

    /** Default for {@link #INS_LINE_WIDTH}. */
    public static final int DEFAULT_INS_LINE_WIDTH = 70;
    /** Default for {@link #INS_OCCUPANCY}. */
    public static final double DEFAULT_INS_OCCUPANCY = 11.0;
    /** Default for {@link #UISO_MULTIPLIER_DECIMALS}. */
    public static final int DEFAULT_UISO_MULTIPLIER_DECIMALS = 3;

    private RBXProperties() {
    }

    /**
     * Properties with no structure specific file: system properties, the user file and the
     * file named by RBX_PROPERTIES.
     *
     * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     */
    public static CompositeConfiguration loadProperties() {
        return loadProperties(null);
    }

    /**
     * This method sets up configuration properties in the following precedence
     * order:
     * <p>
     * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
     * System.setProperty("key","value") within Java code.
     * <p>
     * 2.) Structure specific properties (for example structure.properties)
     * <p>
     * 3.) User specific properties (~/.rbx/rbx.properties)
     * <p>
     * 4.) System wide properties (file defined by environment variable
     * RBX_PROPERTIES)
     *
     * @param file the structure file whose base name locates structure properties, or null.
     * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     * @since 1.0
     */
    public static CompositeConfiguration loadProperties(File file) {

        CompositeConfiguration properties = new CompositeConfiguration();

        /*
          JVM system properties are read first.
          a.) -Dkey=value from the Java command line
          b.) System.setProperty("key","value") within Java code.
         */
        PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
        systemConfiguration.append(new SystemConfiguration());
        systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
        properties.addConfiguration(systemConfiguration);

        // Structure specific options are 2nd.
        if (file != null) {
            String structureBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
            String propertyFilename
                    = (new File(structureBasename + ".properties").exists()) ? structureBasename + ".properties"
                    : (new File(structureBasename + ".prop").exists()) ? structureBasename + ".prop"
                    : null;
            if (propertyFilename != null) {
                File structurePropFile = new File(propertyFilename);
                if (structurePropFile.canRead()) {
                    try {
                        PropertiesConfiguration propertyConfiguration = readPropertyFile(structurePropFile);
                        propertyConfiguration.setHeader("Structure properties from (" + propertyFilename + ").");
                        properties.addConfiguration(propertyConfiguration);
                        properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
                    } catch (ConfigurationException | IOException e) {
                        logger.log(Level.INFO, " Error loading {0}.", structureBasename);
                    }
                }
            }
        }

        // User specific options are 3rd.
        String filename = System.getProperty("user.home") + File.separator + ".rbx/rbx.properties";
        File userPropFile = new File(filename);
        if (userPropFile.exists() && userPropFile.canRead()) {
            try {
                PropertiesConfiguration userConfiguration = readPropertyFile(userPropFile);
                userConfiguration.setHeader("RBX user property file (" + filename + ").");
                properties.addConfiguration(userConfiguration);
            } catch (ConfigurationException e) {
                logger.log(Level.INFO, " Error loading {0}.", filename);
            }
        }

        // System wide options are last.
        filename = System.getenv("RBX_PROPERTIES");
        if (filename != null) {
            File systemPropFile = new File(filename);
            if (systemPropFile.exists() && systemPropFile.canRead()) {
                try {
                    PropertiesConfiguration envConfiguration = readPropertyFile(systemPropFile);
                    envConfiguration.setHeader("Environment variable RBX_PROPERTIES (" + filename + ").");
                    properties.addConfiguration(envConfiguration);
                } catch (ConfigurationException e) {
                    logger.log(Level.INFO, " Error loading {0}.", filename);
                }
            }
        }

        // Echo the interpolated configuration.
        if (logger.isLoggable(Level.FINE)) {
            Iterator<String> i = properties.getKeys();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("\n %-30s %s\n", "Property", "Value"));
            while (i.hasNext()) {
                String s = i.next();
                sb.append(String.format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
            }
            logger.fine(sb.toString());
        }

        return properties;
    }

    private static PropertiesConfiguration readPropertyFile(File propertyFile) throws ConfigurationException {
        FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
                new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
                        .configure(new Parameters().properties()
                                .setFile(propertyFile)
                                .setThrowExceptionOnMissing(true)
                                .setIncludesAllowed(false));
        return builder.getConfiguration();
    }
}
