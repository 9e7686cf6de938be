/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.mrs.pipeline;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.twentyn.mrs.edit.AcquisitionType;
import com.twentyn.mrs.edit.EditTarget;
import com.twentyn.mrs.edit.MegaProtocol;
import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.fit.FitOptions;
import com.twentyn.mrs.fit.FitStyle;
import com.twentyn.mrs.reference.Landmark;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProcessingConfigurationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testBundledDefaults() throws Exception {
    ProcessingConfiguration configuration = ProcessingConfiguration.defaults();

    assertEquals(AcquisitionType.UNEDITED, configuration.getAcquisitionType());
    assertEquals(Landmark.CR_CHO, configuration.getUneditedLandmark());
    assertEquals(Vendor.UNKNOWN, configuration.getVendor());
    assertArrayEquals(FitOptions.METABOLITE_RANGE_PPM, configuration.getMetaboliteFitRangePpm(), 0.0);
    assertEquals(512, configuration.getHsvdPointLimit());
    assertEquals(1, configuration.getWorkerThreads());
    assertFalse(configuration.isEdited());
  }

  @Test
  public void testJsonOverridesOnlyNamedFields() throws Exception {
    ProcessingConfiguration configuration = ProcessingConfiguration.fromJson(
        "{\"acquisition_type\": \"MEGA\", \"edit_target\": \"GABA\", \"fit_style\": \"CONCATENATED\","
            + " \"worker_threads\": 4}");

    assertTrue(configuration.isEdited());
    assertEquals(FitStyle.CONCATENATED, configuration.getFitStyle());
    assertEquals(4, configuration.getWorkerThreads());
    assertEquals(20, configuration.getHsvdInitialOrder());
    assertTrue(configuration.protocol() instanceof MegaProtocol);
  }

  @Test
  public void testLoadsFromFile() throws Exception {
    File file = folder.newFile("run.json");
    Files.write(file.toPath(), "{\"vendor\": \"SIEMENS\", \"fit_zero_fill\": 4}".getBytes(StandardCharsets.UTF_8));

    ProcessingConfiguration configuration = ProcessingConfiguration.load(file);

    assertEquals(Vendor.SIEMENS, configuration.getVendor());
    assertEquals(4, configuration.metaboliteFitOptions().getZeroFill());
  }

  @Test
  public void testSerialisedConfigurationReadsBack() throws Exception {
    ProcessingConfiguration configuration = ProcessingConfiguration.defaults();
    configuration.setEditTarget(EditTarget.NONE);
    configuration.setHsvdPointLimit(256);

    ProcessingConfiguration copy = ProcessingConfiguration.fromJson(configuration.toJson());

    assertEquals(256, copy.getHsvdPointLimit());
  }

  @Test(expected = UnrecognizedPropertyException.class)
  public void testUnknownSettingIsRejected() throws Exception {
    ProcessingConfiguration.fromJson("{\"hsvd_order\": 12}");
  }

  @Test(expected = PreconditionViolationException.class)
  public void testConcatenatedFittingNeedsEditedData() throws Exception {
    ProcessingConfiguration.fromJson("{\"fit_style\": \"CONCATENATED\"}");
  }

  @Test(expected = PreconditionViolationException.class)
  public void testZeroFillMustBePowerOfTwo() throws Exception {
    ProcessingConfiguration configuration = ProcessingConfiguration.defaults();
    configuration.setFitZeroFill(3);
    configuration.validate();
  }
}
