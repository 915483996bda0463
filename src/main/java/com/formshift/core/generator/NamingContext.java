package com.formshift.core.generator;

import com.formshift.core.config.ConverterConfig;

/**
 * Names used when emitting one form.
 *
 * @param namespace     root namespace of the generated project
 * @param formName      source form class name
 * @param viewName      generated view class name
 * @param viewModelName generated view-model class name
 */
public record NamingContext(
    String namespace,
    String formName,
    String viewName,
    String viewModelName
) {

    public static NamingContext of(ConverterConfig.Naming naming, String formName) {
        return new NamingContext(naming.getNamespace(), formName,
                formName + naming.getViewSuffix(), formName + naming.getViewModelSuffix());
    }

    public String viewNamespace() {
        return namespace + ".Views";
    }

    public String viewModelNamespace() {
        return namespace + ".ViewModels";
    }
}
