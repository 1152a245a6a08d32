package it.polimi.ds.ruleir.utils;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * Marks code that intentionally triggers a SpotBugs detector.
 * <p>
 * SpotBugs only matches the annotation by simple name, so there is no need to depend on its annotations artifact.
 */
@Retention(RetentionPolicy.CLASS)
public @interface SuppressFBWarnings {

    /**
     * @return the detector patterns to suppress
     */
    String[] value() default {};

    /**
     * @return why the warning does not apply
     */
    String justification() default "";
}
