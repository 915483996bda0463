package com.formshift.core.generator;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Emits the files that make the output directory a buildable Avalonia desktop project:
 * the {@code .csproj}, {@code App.axaml} with its code-behind, {@code Program.cs} and
 * {@code app.manifest}.
 */
@Component
public class ProjectFileGenerator {

    static final String AVALONIA_VERSION = "11.2.0";
    static final String MVVM_TOOLKIT_VERSION = "8.3.2";

    /**
     * @param namespace root namespace, also used as the project name
     * @param mainView  naming of the window opened at startup, or {@code null} when no form
     *                  converted to a window
     */
    public List<GeneratedArtifact> generate(String namespace, NamingContext mainView) {
        return List.of(
                GeneratedArtifact.of(namespace + ".csproj", projectFile()),
                GeneratedArtifact.of("App.axaml", appMarkup(namespace)),
                GeneratedArtifact.of("App.axaml.cs", appCodeBehind(namespace, mainView)),
                GeneratedArtifact.of("Program.cs", program(namespace)),
                GeneratedArtifact.of("app.manifest", manifest(namespace)));
    }

    String projectFile() {
        return """
                <Project Sdk="Microsoft.NET.Sdk">

                  <PropertyGroup>
                    <OutputType>WinExe</OutputType>
                    <TargetFramework>net8.0</TargetFramework>
                    <Nullable>enable</Nullable>
                    <BuiltInComInteropSupport>true</BuiltInComInteropSupport>
                    <ApplicationManifest>app.manifest</ApplicationManifest>
                    <AvaloniaUseCompiledBindingsByDefault>true</AvaloniaUseCompiledBindingsByDefault>
                  </PropertyGroup>

                  <ItemGroup>
                    <PackageReference Include="Avalonia" Version="%1$s" />
                    <PackageReference Include="Avalonia.Desktop" Version="%1$s" />
                    <PackageReference Include="Avalonia.Themes.Fluent" Version="%1$s" />
                    <PackageReference Include="Avalonia.Fonts.Inter" Version="%1$s" />
                    <PackageReference Include="CommunityToolkit.Mvvm" Version="%2$s" />
                  </ItemGroup>

                </Project>
                """.formatted(AVALONIA_VERSION, MVVM_TOOLKIT_VERSION);
    }

    String appMarkup(String namespace) {
        return """
                <Application xmlns="https://github.com/avaloniaui"
                             xmlns:x="http://schemas.microsoft.com/winfx/2006/xaml"
                             x:Class="%s.App"
                             RequestedThemeVariant="Default">

                    <Application.Styles>
                        <FluentTheme />
                    </Application.Styles>
                </Application>
                """.formatted(namespace);
    }

    String appCodeBehind(String namespace, NamingContext mainView) {
        String startup = mainView == null
                ? "            // No converted form is a window; set desktop.MainWindow here.\n"
                : """
                            desktop.MainWindow = new %s
                            {
                                DataContext = new %s()
                            };
                """.formatted(mainView.viewName(), mainView.viewModelName());
        return """
                using Avalonia;
                using Avalonia.Controls.ApplicationLifetimes;
                using Avalonia.Markup.Xaml;
                using %1$s.ViewModels;
                using %1$s.Views;

                namespace %1$s;

                public partial class App : Application
                {
                    public override void Initialize()
                    {
                        AvaloniaXamlLoader.Load(this);
                    }

                    public override void OnFrameworkInitializationCompleted()
                    {
                        if (ApplicationLifetime is IClassicDesktopStyleApplicationLifetime desktop)
                        {
                %2$s        }

                        base.OnFrameworkInitializationCompleted();
                    }
                }
                """.formatted(namespace, startup);
    }

    String program(String namespace) {
        return """
                using Avalonia;
                using System;

                namespace %s;

                class Program
                {
                    [STAThread]
                    public static void Main(string[] args) => BuildAvaloniaApp()
                        .StartWithClassicDesktopLifetime(args);

                    public static AppBuilder BuildAvaloniaApp()
                        => AppBuilder.Configure<App>()
                            .UsePlatformDetect()
                            .WithInterFont()
                            .LogToTrace();
                }
                """.formatted(namespace);
    }

    String manifest(String namespace) {
        return """
                <?xml version="1.0" encoding="utf-8"?>
                <assembly manifestVersion="1.0" xmlns="urn:schemas-microsoft-com:asm.v1">
                  <assemblyIdentity version="1.0.0.0" name="%s.app"/>
                  <compatibility xmlns="urn:schemas-microsoft-com:compatibility.v1">
                    <application>
                      <supportedOS Id="{8e0f7a12-bfb3-4fe8-b9a5-48fd50a15a9a}" />
                    </application>
                  </compatibility>
                </assembly>
                """.formatted(namespace);
    }
}
