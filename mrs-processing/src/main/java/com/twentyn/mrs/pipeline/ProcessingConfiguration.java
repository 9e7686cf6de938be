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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.mrs.align.DriftMeter;
import com.twentyn.mrs.align.SpectralRegistration;
import com.twentyn.mrs.correct.ResidualWaterRemover;
import com.twentyn.mrs.edit.AcquisitionProtocol;
import com.twentyn.mrs.edit.AcquisitionProtocols;
import com.twentyn.mrs.edit.AcquisitionType;
import com.twentyn.mrs.edit.EditTarget;
import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.fit.FitOptions;
import com.twentyn.mrs.fit.FitStyle;
import com.twentyn.mrs.reference.CrossCorrelationReferencer;
import com.twentyn.mrs.reference.Landmark;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of a processing run.  Every field has a default; {@link #defaults()} reads them from the bundled
 * mrs-defaults.json and {@link #load(File)} overlays a user file on top of them.
 */
public class ProcessingConfiguration {
  public static final String DEFAULTS_RESOURCE = "mrs-defaults.json";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  @JsonProperty("acquisition_type")
  private AcquisitionType acquisitionType = AcquisitionType.UNEDITED;

  @JsonProperty("edit_target")
  private EditTarget editTarget = EditTarget.NONE;

  @JsonProperty("fit_style")
  private FitStyle fitStyle = FitStyle.SEPARATE;

  @JsonProperty("vendor")
  private Vendor vendor = Vendor.UNKNOWN;

  @JsonProperty("unedited_landmark")
  private Landmark uneditedLandmark = Landmark.CR_CHO;

  @JsonProperty("metabolite_fit_range_ppm")
  private double[] metaboliteFitRangePpm = FitOptions.METABOLITE_RANGE_PPM.clone();

  @JsonProperty("water_fit_range_ppm")
  private double[] waterFitRangePpm = FitOptions.WATER_RANGE_PPM.clone();

  @JsonProperty("baseline_knot_spacing_ppm")
  private double baselineKnotSpacingPpm = 0.4;

  @JsonProperty("fit_zero_fill")
  private int fitZeroFill = 2;

  @JsonProperty("included_metabolites")
  private List<String> includedMetabolites = new ArrayList<>();

  @JsonProperty("include_macromolecules")
  private boolean includeMacromolecules = true;

  @JsonProperty("water_removal_range_ppm")
  private double[] waterRemovalRangePpm = {ResidualWaterRemover.DEFAULT_LOW_PPM, ResidualWaterRemover.DEFAULT_HIGH_PPM};

  @JsonProperty("hsvd_initial_order")
  private int hsvdInitialOrder = ResidualWaterRemover.DEFAULT_ORDER;

  @JsonProperty("hsvd_min_order")
  private int hsvdMinOrder = ResidualWaterRemover.DEFAULT_MIN_ORDER;

  @JsonProperty("hsvd_point_limit")
  private int hsvdPointLimit = ResidualWaterRemover.DEFAULT_POINT_LIMIT;

  @JsonProperty("dc_correction_percentage")
  private double dcCorrectionPercentage = ResidualWaterRemover.DEFAULT_DC_PERCENTAGE;

  @JsonProperty("registration_iterations")
  private int registrationIterations = SpectralRegistration.DEFAULT_ITERATIONS;

  @JsonProperty("fit_max_iterations")
  private int fitMaxIterations = 200;

  @JsonProperty("fit_max_evaluations")
  private int fitMaxEvaluations = 4000;

  @JsonProperty("worker_threads")
  private int workerThreads = 1;

  public ProcessingConfiguration() {
  }

  /** The bundled defaults. */
  public static ProcessingConfiguration defaults() throws IOException {
    try (InputStream in = ProcessingConfiguration.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
      }
      return OBJECT_MAPPER.readValue(in, ProcessingConfiguration.class).validate();
    }
  }

  /** Reads a JSON file; fields it does not mention keep their default values. */
  public static ProcessingConfiguration load(File file) throws IOException {
    ProcessingConfiguration configuration = defaults();
    OBJECT_MAPPER.readerForUpdating(configuration).readValue(file);
    return configuration.validate();
  }

  public static ProcessingConfiguration fromJson(String json) throws IOException {
    ProcessingConfiguration configuration = defaults();
    OBJECT_MAPPER.readerForUpdating(configuration).readValue(json);
    return configuration.validate();
  }

  public String toJson() throws IOException {
    return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
  }

  /**
   * @return this configuration
   * @throws PreconditionViolationException naming the first invalid setting
   */
  public ProcessingConfiguration validate() {
    requireRange("metabolite_fit_range_ppm", metaboliteFitRangePpm);
    requireRange("water_fit_range_ppm", waterFitRangePpm);
    requireRange("water_removal_range_ppm", waterRemovalRangePpm);
    if (!(baselineKnotSpacingPpm > 0.0)) {
      throw new PreconditionViolationException("baseline_knot_spacing_ppm must be positive");
    }
    if (fitZeroFill < 1 || Integer.bitCount(fitZeroFill) != 1) {
      throw new PreconditionViolationException("fit_zero_fill must be a positive power of two");
    }
    if (hsvdMinOrder < 1 || hsvdInitialOrder < hsvdMinOrder) {
      throw new PreconditionViolationException("hsvd orders must satisfy 1 <= hsvd_min_order <= hsvd_initial_order");
    }
    if (!(dcCorrectionPercentage > 0.0) || dcCorrectionPercentage > 100.0) {
      throw new PreconditionViolationException("dc_correction_percentage must be in (0, 100]");
    }
    if (registrationIterations < 1 || fitMaxIterations < 1 || fitMaxEvaluations < 1 || workerThreads < 1) {
      throw new PreconditionViolationException("Iteration caps and worker_threads must be positive");
    }
    if (acquisitionType == AcquisitionType.UNEDITED && fitStyle == FitStyle.CONCATENATED) {
      throw new PreconditionViolationException("Concatenated fitting needs difference-edited data");
    }
    return this;
  }

  private static void requireRange(String name, double[] range) {
    if (range == null || range.length != 2 || !(range[1] > range[0])) {
      throw new PreconditionViolationException(name + " must be [low, high] with low < high");
    }
  }

  /** Protocol for the configured acquisition type; fails for unsupported editing targets. */
  public AcquisitionProtocol protocol() {
    return AcquisitionProtocols.create(acquisitionType, editTarget, uneditedLandmark);
  }

  public FitOptions metaboliteFitOptions() {
    return FitOptions.metaboliteDefaults()
        .withRange(metaboliteFitRangePpm[0], metaboliteFitRangePpm[1])
        .withKnotSpacing(baselineKnotSpacingPpm)
        .withZeroFill(fitZeroFill)
        .withIncludedMetabolites(includedMetabolites)
        .withIterationCaps(fitMaxIterations, fitMaxEvaluations);
  }

  public FitOptions waterFitOptions() {
    return FitOptions.waterDefaults()
        .withRange(waterFitRangePpm[0], waterFitRangePpm[1])
        .withKnotSpacing(baselineKnotSpacingPpm)
        .withZeroFill(fitZeroFill)
        .withIterationCaps(fitMaxIterations, fitMaxEvaluations);
  }

  public ResidualWaterRemover waterRemover() {
    return new ResidualWaterRemover(waterRemovalRangePpm[0], waterRemovalRangePpm[1], hsvdInitialOrder, hsvdMinOrder,
        hsvdPointLimit, dcCorrectionPercentage);
  }

  public SpectralRegistration registration() {
    return new SpectralRegistration(new CrossCorrelationReferencer(), new DriftMeter(), registrationIterations,
        SpectralRegistration.DEFAULT_WINDOW_SECONDS);
  }

  public AcquisitionType getAcquisitionType() {
    return acquisitionType;
  }

  public void setAcquisitionType(AcquisitionType acquisitionType) {
    this.acquisitionType = acquisitionType;
  }

  public EditTarget getEditTarget() {
    return editTarget;
  }

  public void setEditTarget(EditTarget editTarget) {
    this.editTarget = editTarget;
  }

  public FitStyle getFitStyle() {
    return fitStyle;
  }

  public void setFitStyle(FitStyle fitStyle) {
    this.fitStyle = fitStyle;
  }

  public Vendor getVendor() {
    return vendor;
  }

  public void setVendor(Vendor vendor) {
    this.vendor = vendor;
  }

  public Landmark getUneditedLandmark() {
    return uneditedLandmark;
  }

  public void setUneditedLandmark(Landmark uneditedLandmark) {
    this.uneditedLandmark = uneditedLandmark;
  }

  public double[] getMetaboliteFitRangePpm() {
    return metaboliteFitRangePpm.clone();
  }

  public void setMetaboliteFitRangePpm(double[] metaboliteFitRangePpm) {
    this.metaboliteFitRangePpm = metaboliteFitRangePpm.clone();
  }

  public double[] getWaterFitRangePpm() {
    return waterFitRangePpm.clone();
  }

  public void setWaterFitRangePpm(double[] waterFitRangePpm) {
    this.waterFitRangePpm = waterFitRangePpm.clone();
  }

  public double getBaselineKnotSpacingPpm() {
    return baselineKnotSpacingPpm;
  }

  public void setBaselineKnotSpacingPpm(double baselineKnotSpacingPpm) {
    this.baselineKnotSpacingPpm = baselineKnotSpacingPpm;
  }

  public int getFitZeroFill() {
    return fitZeroFill;
  }

  public void setFitZeroFill(int fitZeroFill) {
    this.fitZeroFill = fitZeroFill;
  }

  public List<String> getIncludedMetabolites() {
    return new ArrayList<>(includedMetabolites);
  }

  public void setIncludedMetabolites(List<String> includedMetabolites) {
    this.includedMetabolites = new ArrayList<>(includedMetabolites);
  }

  public boolean isIncludeMacromolecules() {
    return includeMacromolecules;
  }

  public void setIncludeMacromolecules(boolean includeMacromolecules) {
    this.includeMacromolecules = includeMacromolecules;
  }

  public double[] getWaterRemovalRangePpm() {
    return waterRemovalRangePpm.clone();
  }

  public void setWaterRemovalRangePpm(double[] waterRemovalRangePpm) {
    this.waterRemovalRangePpm = waterRemovalRangePpm.clone();
  }

  public int getHsvdInitialOrder() {
    return hsvdInitialOrder;
  }

  public void setHsvdInitialOrder(int hsvdInitialOrder) {
    this.hsvdInitialOrder = hsvdInitialOrder;
  }

  public int getHsvdMinOrder() {
    return hsvdMinOrder;
  }

  public void setHsvdMinOrder(int hsvdMinOrder) {
    this.hsvdMinOrder = hsvdMinOrder;
  }

  public int getHsvdPointLimit() {
    return hsvdPointLimit;
  }

  public void setHsvdPointLimit(int hsvdPointLimit) {
    this.hsvdPointLimit = hsvdPointLimit;
  }

  public double getDcCorrectionPercentage() {
    return dcCorrectionPercentage;
  }

  public void setDcCorrectionPercentage(double dcCorrectionPercentage) {
    this.dcCorrectionPercentage = dcCorrectionPercentage;
  }

  public int getRegistrationIterations() {
    return registrationIterations;
  }

  public void setRegistrationIterations(int registrationIterations) {
    this.registrationIterations = registrationIterations;
  }

  public int getFitMaxIterations() {
    return fitMaxIterations;
  }

  public void setFitMaxIterations(int fitMaxIterations) {
    this.fitMaxIterations = fitMaxIterations;
  }

  public int getFitMaxEvaluations() {
    return fitMaxEvaluations;
  }

  public void setFitMaxEvaluations(int fitMaxEvaluations) {
    this.fitMaxEvaluations = fitMaxEvaluations;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  @JsonIgnore
  public boolean isEdited() {
    return acquisitionType != AcquisitionType.UNEDITED;
  }
}
