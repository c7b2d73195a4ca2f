/**
 * REST controllers. Thin adapters over {@link com.phillippitts.hsie.service.pipeline.EvidencePipeline}.
 */
package com.phillippitts.hsie.presentation.controller;
