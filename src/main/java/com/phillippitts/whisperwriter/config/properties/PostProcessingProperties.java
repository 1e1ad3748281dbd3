package com.phillippitts.whisperwriter.config.properties;

import com.phillippitts.whisperwriter.domain.PostProcessingOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Typed properties for transcript formatting ({@code post-processing.*}).
 */
@ConfigurationProperties(prefix = "post-processing")
public class PostProcessingProperties {

    private final boolean removeTrailingPeriod;
    private final boolean addTrailingSpace;
    private final boolean removeCapitalization;

    @ConstructorBinding
    public PostProcessingProperties(Boolean removeTrailingPeriod,
                                    Boolean addTrailingSpace,
                                    Boolean removeCapitalization) {
        this.removeTrailingPeriod = removeTrailingPeriod != null && removeTrailingPeriod;
        this.addTrailingSpace = addTrailingSpace == null || addTrailingSpace;
        this.removeCapitalization = removeCapitalization != null && removeCapitalization;
    }

    public boolean isRemoveTrailingPeriod() {
        return removeTrailingPeriod;
    }

    public boolean isAddTrailingSpace() {
        return addTrailingSpace;
    }

    public boolean isRemoveCapitalization() {
        return removeCapitalization;
    }

    public PostProcessingOptions toOptions() {
        return new PostProcessingOptions(removeTrailingPeriod, addTrailingSpace, removeCapitalization);
    }
}
