package com.modeldoc.validation;

import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.model.Model;
import java.util.List;

/**
 * A check run over the normalized model, before linking. Rules report problems in the order they
 * find them and never change the model.
 */
public interface ValidationRule {

    /**
     * @param model normalized model
     * @return diagnostics, possibly empty, never null
     */
    List<LoaderMessage> validate(Model model);
}
