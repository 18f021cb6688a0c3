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
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * <p>Abstract BaseRBXTest class.</p>
 *
 * @author Michael J. Schnieders
 */
public abstract class BaseRBXTest {
    /**
     * Constant <code>logger</code>
     */
    protected static final Logger logger = Logger.getLogger(BaseRBXTest.class.getName());
    private static final Level origLevel = Logger.getLogger("rbx").getLevel();
    private static final Level testLevel;
    private static final Level rbxLevel;
    private static Properties properties;

    static {
        Level level;
        try {
            level = Level.parse(System.getProperty("rbx.test.log", "INFO").toUpperCase());
        } catch (Exception ex) {
            logger.warning(String.format(" Exception %s in parsing value of rbx.test.log", ex));
            level = origLevel;
        }
        testLevel = level;

        try {
            level = Level.parse(System.getProperty("rbx.log", "INFO").toUpperCase());
        } catch (Exception ex) {
            logger.warning(String.format(" Exception %s in parsing value of rbx.log", ex));
            level = origLevel;
        }
        rbxLevel = level;
    }

    /**
     * <p>afterClass.</p>
     */
    @AfterClass
    public static void afterClass() {
        Logger.getLogger("rbx").setLevel(origLevel);
        logger.setLevel(origLevel);
    }

    /**
     * <p>afterTest.</p>
     */
    @After
    public void afterTest() {
        // All properties are set to the values they were at the beginning of the test.
        System.setProperties(properties);
    }

    /**
     * <p>beforeClass.</p>
     */
    @BeforeClass
    public static void beforeClass() {
        // Set appropriate logging levels for interior/exterior Loggers.
        Logger.getLogger("rbx").setLevel(rbxLevel);
        logger.setLevel(testLevel);
    }

    /**
     * <p>beforeTest.</p>
     */
    @Before
    public void beforeTest() {
        // New properties object that will hold the property key-value pairs that were present
        // at the beginning of the test.
        properties = new Properties();

        // currentProperties holds the properties at the beginning of the test.
        Properties currentProperties = System.getProperties();

        // All key-value pairs from currentProperties are stored in the properties object.
        for (String key : currentProperties.stringPropertyNames()) {
            properties.setProperty(key, currentProperties.getProperty(key));
        }
    }

    /**
     * Read a test resource, relative to the test class, as UTF-8 text.
     *
     * @param name the resource name.
     * @return the resource contents.
     * @throws IOException if the resource is missing or unreadable.
     */
    protected String readResource(String name) throws IOException {
        try (InputStream stream = getClass().getResourceAsStream(name)) {
            if (stream == null) {
                throw new IOException(String.format(" Test resource %s was not found.", name));
            }
            return IOUtils.toString(stream, StandardCharsets.UTF_8);
        }
    }

    /**
     * Locate a test resource, relative to the test class, on the file system.
     *
     * @param name the resource name.
     * @return the resource file.
     * @throws IOException if the resource is missing or not a file.
     */
    protected File getResourceFile(String name) throws IOException {
        URL url = getClass().getResource(name);
        if (url == null) {
            throw new IOException(String.format(" Test resource %s was not found.", name));
        }
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IOException(e);
        }
    }
}
