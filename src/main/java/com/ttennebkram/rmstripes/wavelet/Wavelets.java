package com.ttennebkram.rmstripes.wavelet;

import com.ttennebkram.rmstripes.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the wavelet bases available for decomposition, keyed by their
 * conventional short names ("haar", "db10", "sym8", "bior2.8", ...).
 *
 * Usage:
 *   Wavelet wavelet = Wavelets.get("db10");
 */
public final class Wavelets {

    private static final Map<String, Wavelet> WAVELETS = new LinkedHashMap<>();

    private static final double H = 0.7071067811865476;

    static {
        register("haar",
                new double[]{H, H},
                new double[]{-H, H},
                new double[]{H, H},
                new double[]{H, -H});
        alias("db1", "haar");

        register("db2",
                new double[]{
                    -0.12940952255092145, 0.22414386804185735, 0.836516303737469, 0.48296291314469025},
                new double[]{
                    -0.48296291314469025, 0.836516303737469, -0.22414386804185735, -0.12940952255092145},
                new double[]{
                    0.48296291314469025, 0.836516303737469, 0.22414386804185735, -0.12940952255092145},
                new double[]{
                    -0.12940952255092145, -0.22414386804185735, 0.836516303737469, -0.48296291314469025});

        register("db4",
                new double[]{
                    -0.010597401784997278, 0.032883011666982945, 0.030841381835986965, -0.18703481171888114,
                    -0.02798376941698385, 0.6308807679295904, 0.7148465705525415, 0.23037781330885523},
                new double[]{
                    -0.23037781330885523, 0.7148465705525415, -0.6308807679295904, -0.02798376941698385,
                    0.18703481171888114, 0.030841381835986965, -0.032883011666982945, -0.010597401784997278},
                new double[]{
                    0.23037781330885523, 0.7148465705525415, 0.6308807679295904, -0.02798376941698385,
                    -0.18703481171888114, 0.030841381835986965, 0.032883011666982945, -0.010597401784997278},
                new double[]{
                    -0.010597401784997278, -0.032883011666982945, 0.030841381835986965, 0.18703481171888114,
                    -0.02798376941698385, -0.6308807679295904, 0.7148465705525415, -0.23037781330885523});

        register("db7",
                new double[]{
                    0.0003537138000010399, -0.0018016407039998328, 0.00042957797300470274,
                    0.012550998556013784, -0.01657454163101562, -0.03802993693503463, 0.0806126091510659,
                    0.07130921926705004, -0.22403618499416572, -0.14390600392910627, 0.4697822874053586,
                    0.7291320908465551, 0.39653931948230575, 0.07785205408506236},
                new double[]{
                    -0.07785205408506236, 0.39653931948230575, -0.7291320908465551, 0.4697822874053586,
                    0.14390600392910627, -0.22403618499416572, -0.07130921926705004, 0.0806126091510659,
                    0.03802993693503463, -0.01657454163101562, -0.012550998556013784, 0.00042957797300470274,
                    0.0018016407039998328, 0.0003537138000010399},
                new double[]{
                    0.07785205408506236, 0.39653931948230575, 0.7291320908465551, 0.4697822874053586,
                    -0.14390600392910627, -0.22403618499416572, 0.07130921926705004, 0.0806126091510659,
                    -0.03802993693503463, -0.01657454163101562, 0.012550998556013784, 0.00042957797300470274,
                    -0.0018016407039998328, 0.0003537138000010399},
                new double[]{
                    0.0003537138000010399, 0.0018016407039998328, 0.00042957797300470274,
                    -0.012550998556013784, -0.01657454163101562, 0.03802993693503463, 0.0806126091510659,
                    -0.07130921926705004, -0.22403618499416572, 0.14390600392910627, 0.4697822874053586,
                    -0.7291320908465551, 0.39653931948230575, -0.07785205408506236});

        register("db8",
                new double[]{
                    -0.00011747678400228192, 0.0006754494059985568, -0.0003917403729959771,
                    -0.00487035299301066, 0.008746094047015655, 0.013981027917015516, -0.04408825393106472,
                    -0.01736930100202211, 0.128747426620186, 0.00047248457399797254, -0.2840155429624281,
                    -0.015829105256023893, 0.5853546836548691, 0.6756307362980128, 0.3128715909144659,
                    0.05441584224308161},
                new double[]{
                    -0.05441584224308161, 0.3128715909144659, -0.6756307362980128, 0.5853546836548691,
                    0.015829105256023893, -0.2840155429624281, -0.00047248457399797254, 0.128747426620186,
                    0.01736930100202211, -0.04408825393106472, -0.013981027917015516, 0.008746094047015655,
                    0.00487035299301066, -0.0003917403729959771, -0.0006754494059985568,
                    -0.00011747678400228192},
                new double[]{
                    0.05441584224308161, 0.3128715909144659, 0.6756307362980128, 0.5853546836548691,
                    -0.015829105256023893, -0.2840155429624281, 0.00047248457399797254, 0.128747426620186,
                    -0.01736930100202211, -0.04408825393106472, 0.013981027917015516, 0.008746094047015655,
                    -0.00487035299301066, -0.0003917403729959771, 0.0006754494059985568,
                    -0.00011747678400228192},
                new double[]{
                    -0.00011747678400228192, -0.0006754494059985568, -0.0003917403729959771,
                    0.00487035299301066, 0.008746094047015655, -0.013981027917015516, -0.04408825393106472,
                    0.01736930100202211, 0.128747426620186, -0.00047248457399797254, -0.2840155429624281,
                    0.015829105256023893, 0.5853546836548691, -0.6756307362980128, 0.3128715909144659,
                    -0.05441584224308161});

        register("db10",
                new double[]{
                    -1.326420300235487e-05, 9.358867000108985e-05, -0.0001164668549943862,
                    -0.0006858566950046825, 0.00199240529499085, 0.0013953517469940798,
                    -0.010733175482979604, 0.0036065535669883944, 0.03321267405893324, -0.02945753682194567,
                    -0.07139414716586077, 0.09305736460380659, 0.12736934033574265, -0.19594627437659665,
                    -0.24984642432648865, 0.2811723436604265, 0.6884590394525921, 0.5272011889309198,
                    0.18817680007762133, 0.026670057900950818},
                new double[]{
                    -0.026670057900950818, 0.18817680007762133, -0.5272011889309198, 0.6884590394525921,
                    -0.2811723436604265, -0.24984642432648865, 0.19594627437659665, 0.12736934033574265,
                    -0.09305736460380659, -0.07139414716586077, 0.02945753682194567, 0.03321267405893324,
                    -0.0036065535669883944, -0.010733175482979604, -0.0013953517469940798,
                    0.00199240529499085, 0.0006858566950046825, -0.0001164668549943862,
                    -9.358867000108985e-05, -1.326420300235487e-05},
                new double[]{
                    0.026670057900950818, 0.18817680007762133, 0.5272011889309198, 0.6884590394525921,
                    0.2811723436604265, -0.24984642432648865, -0.19594627437659665, 0.12736934033574265,
                    0.09305736460380659, -0.07139414716586077, -0.02945753682194567, 0.03321267405893324,
                    0.0036065535669883944, -0.010733175482979604, 0.0013953517469940798, 0.00199240529499085,
                    -0.0006858566950046825, -0.0001164668549943862, 9.358867000108985e-05,
                    -1.326420300235487e-05},
                new double[]{
                    -1.326420300235487e-05, -9.358867000108985e-05, -0.0001164668549943862,
                    0.0006858566950046825, 0.00199240529499085, -0.0013953517469940798,
                    -0.010733175482979604, -0.0036065535669883944, 0.03321267405893324, 0.02945753682194567,
                    -0.07139414716586077, -0.09305736460380659, 0.12736934033574265, 0.19594627437659665,
                    -0.24984642432648865, -0.2811723436604265, 0.6884590394525921, -0.5272011889309198,
                    0.18817680007762133, -0.026670057900950818});

        register("db11",
                new double[]{
                    4.494274277236352e-06, -3.463498418698379e-05, 5.443907469936638e-05,
                    0.00024915252355281426, -0.0008930232506662366, -0.00030859285881515924,
                    0.004928417656058778, -0.0033408588730145018, -0.015364820906201324, 0.02084090436018004,
                    0.03133509021904531, -0.06643878569502022, -0.04647995511667613, 0.14981201246638268,
                    0.06604358819669089, -0.27423084681792875, -0.16227524502747828, 0.41196436894789695,
                    0.6856867749161785, 0.44989976435603013, 0.1440670211506196, 0.01869429776147044},
                new double[]{
                    -0.01869429776147044, 0.1440670211506196, -0.44989976435603013, 0.6856867749161785,
                    -0.41196436894789695, -0.16227524502747828, 0.27423084681792875, 0.06604358819669089,
                    -0.14981201246638268, -0.04647995511667613, 0.06643878569502022, 0.03133509021904531,
                    -0.02084090436018004, -0.015364820906201324, 0.0033408588730145018, 0.004928417656058778,
                    0.00030859285881515924, -0.0008930232506662366, -0.00024915252355281426,
                    5.443907469936638e-05, 3.463498418698379e-05, 4.494274277236352e-06},
                new double[]{
                    0.01869429776147044, 0.1440670211506196, 0.44989976435603013, 0.6856867749161785,
                    0.41196436894789695, -0.16227524502747828, -0.27423084681792875, 0.06604358819669089,
                    0.14981201246638268, -0.04647995511667613, -0.06643878569502022, 0.03133509021904531,
                    0.02084090436018004, -0.015364820906201324, -0.0033408588730145018, 0.004928417656058778,
                    -0.00030859285881515924, -0.0008930232506662366, 0.00024915252355281426,
                    5.443907469936638e-05, -3.463498418698379e-05, 4.494274277236352e-06},
                new double[]{
                    4.494274277236352e-06, 3.463498418698379e-05, 5.443907469936638e-05,
                    -0.00024915252355281426, -0.0008930232506662366, 0.00030859285881515924,
                    0.004928417656058778, 0.0033408588730145018, -0.015364820906201324, -0.02084090436018004,
                    0.03133509021904531, 0.06643878569502022, -0.04647995511667613, -0.14981201246638268,
                    0.06604358819669089, 0.27423084681792875, -0.16227524502747828, -0.41196436894789695,
                    0.6856867749161785, -0.44989976435603013, 0.1440670211506196, -0.01869429776147044});

        register("sym5",
                new double[]{
                    0.027333068345077982, 0.029519490925774643, -0.039134249302383094, 0.1993975339773936,
                    0.7234076904024206, 0.6339789634582119, 0.01660210576452232, -0.17532808990845047,
                    -0.021101834024758855, 0.019538882735286728},
                new double[]{
                    -0.019538882735286728, -0.021101834024758855, 0.17532808990845047, 0.01660210576452232,
                    -0.6339789634582119, 0.7234076904024206, -0.1993975339773936, -0.039134249302383094,
                    -0.029519490925774643, 0.027333068345077982},
                new double[]{
                    0.019538882735286728, -0.021101834024758855, -0.17532808990845047, 0.01660210576452232,
                    0.6339789634582119, 0.7234076904024206, 0.1993975339773936, -0.039134249302383094,
                    0.029519490925774643, 0.027333068345077982},
                new double[]{
                    0.027333068345077982, -0.029519490925774643, -0.039134249302383094, -0.1993975339773936,
                    0.7234076904024206, -0.6339789634582119, 0.01660210576452232, 0.17532808990845047,
                    -0.021101834024758855, -0.019538882735286728});

        register("sym7",
                new double[]{
                    0.002681814568257878, -0.0010473848886829163, -0.01263630340325193, 0.03051551316596357,
                    0.0678926935013727, -0.049552834937127255, 0.017441255086855827, 0.5361019170917628,
                    0.767764317003164, 0.2886296317515146, -0.14004724044296152, -0.10780823770381774,
                    0.004010244871533663, 0.010268176708511255},
                new double[]{
                    -0.010268176708511255, 0.004010244871533663, 0.10780823770381774, -0.14004724044296152,
                    -0.2886296317515146, 0.767764317003164, -0.5361019170917628, 0.017441255086855827,
                    0.049552834937127255, 0.0678926935013727, -0.03051551316596357, -0.01263630340325193,
                    0.0010473848886829163, 0.002681814568257878},
                new double[]{
                    0.010268176708511255, 0.004010244871533663, -0.10780823770381774, -0.14004724044296152,
                    0.2886296317515146, 0.767764317003164, 0.5361019170917628, 0.017441255086855827,
                    -0.049552834937127255, 0.0678926935013727, 0.03051551316596357, -0.01263630340325193,
                    -0.0010473848886829163, 0.002681814568257878},
                new double[]{
                    0.002681814568257878, 0.0010473848886829163, -0.01263630340325193, -0.03051551316596357,
                    0.0678926935013727, 0.049552834937127255, 0.017441255086855827, -0.5361019170917628,
                    0.767764317003164, -0.2886296317515146, -0.14004724044296152, 0.10780823770381774,
                    0.004010244871533663, -0.010268176708511255});

        register("sym8",
                new double[]{
                    -0.0033824159510061256, -0.0005421323317911481, 0.03169508781149298,
                    0.007607487324917605, -0.1432942383508097, -0.061273359067658524, 0.4813596512583722,
                    0.7771857517005235, 0.3644418948353314, -0.05194583810770904, -0.027219029917056003,
                    0.049137179673607506, 0.003808752013890615, -0.01495225833704823, -0.0003029205147213668,
                    0.0018899503327594609},
                new double[]{
                    -0.0018899503327594609, -0.0003029205147213668, 0.01495225833704823,
                    0.003808752013890615, -0.049137179673607506, -0.027219029917056003, 0.05194583810770904,
                    0.3644418948353314, -0.7771857517005235, 0.4813596512583722, 0.061273359067658524,
                    -0.1432942383508097, -0.007607487324917605, 0.03169508781149298, 0.0005421323317911481,
                    -0.0033824159510061256},
                new double[]{
                    0.0018899503327594609, -0.0003029205147213668, -0.01495225833704823,
                    0.003808752013890615, 0.049137179673607506, -0.027219029917056003, -0.05194583810770904,
                    0.3644418948353314, 0.7771857517005235, 0.4813596512583722, -0.061273359067658524,
                    -0.1432942383508097, 0.007607487324917605, 0.03169508781149298, -0.0005421323317911481,
                    -0.0033824159510061256},
                new double[]{
                    -0.0033824159510061256, 0.0005421323317911481, 0.03169508781149298,
                    -0.007607487324917605, -0.1432942383508097, 0.061273359067658524, 0.4813596512583722,
                    -0.7771857517005235, 0.3644418948353314, 0.05194583810770904, -0.027219029917056003,
                    -0.049137179673607506, 0.003808752013890615, 0.01495225833704823, -0.0003029205147213668,
                    -0.0018899503327594609});

        register("sym9",
                new double[]{
                    0.0014009155259146807, 0.0006197808889855868, -0.013271967781817119,
                    -0.01152821020767923, 0.03022487885827568, 0.0005834627461258068, -0.05456895843083407,
                    0.238760914607303, 0.717897082764412, 0.6173384491409358, 0.035272488035271894,
                    -0.19155083129728512, -0.018233770779395985, 0.06207778930288603, 0.008859267493400484,
                    -0.010264064027633142, -0.0004731544986800831, 0.0010694900329086053},
                new double[]{
                    -0.0010694900329086053, -0.0004731544986800831, 0.010264064027633142,
                    0.008859267493400484, -0.06207778930288603, -0.018233770779395985, 0.19155083129728512,
                    0.035272488035271894, -0.6173384491409358, 0.717897082764412, -0.238760914607303,
                    -0.05456895843083407, -0.0005834627461258068, 0.03022487885827568, 0.01152821020767923,
                    -0.013271967781817119, -0.0006197808889855868, 0.0014009155259146807},
                new double[]{
                    0.0010694900329086053, -0.0004731544986800831, -0.010264064027633142,
                    0.008859267493400484, 0.06207778930288603, -0.018233770779395985, -0.19155083129728512,
                    0.035272488035271894, 0.6173384491409358, 0.717897082764412, 0.238760914607303,
                    -0.05456895843083407, 0.0005834627461258068, 0.03022487885827568, -0.01152821020767923,
                    -0.013271967781817119, 0.0006197808889855868, 0.0014009155259146807},
                new double[]{
                    0.0014009155259146807, -0.0006197808889855868, -0.013271967781817119,
                    0.01152821020767923, 0.03022487885827568, -0.0005834627461258068, -0.05456895843083407,
                    -0.238760914607303, 0.717897082764412, -0.6173384491409358, 0.035272488035271894,
                    0.19155083129728512, -0.018233770779395985, -0.06207778930288603, 0.008859267493400484,
                    0.010264064027633142, -0.0004731544986800831, -0.0010694900329086053});

        register("sym10",
                new double[]{
                    0.0007701598091144901, 9.563267072289475e-05, -0.008641299277022422,
                    -0.0014653825813050513, 0.0459272392310922, 0.011609893903711381, -0.15949427888491757,
                    -0.07088053578324385, 0.47169066693843925, 0.7695100370211071, 0.38382676106708546,
                    -0.03553674047381755, -0.0319900568824278, 0.04999497207737669, 0.005764912033581909,
                    -0.02035493981231129, -0.0008043589320165449, 0.004593173585311828,
                    5.7036083618494284e-05, -0.0004593294210046588},
                new double[]{
                    0.0004593294210046588, 5.7036083618494284e-05, -0.004593173585311828,
                    -0.0008043589320165449, 0.02035493981231129, 0.005764912033581909, -0.04999497207737669,
                    -0.0319900568824278, 0.03553674047381755, 0.38382676106708546, -0.7695100370211071,
                    0.47169066693843925, 0.07088053578324385, -0.15949427888491757, -0.011609893903711381,
                    0.0459272392310922, 0.0014653825813050513, -0.008641299277022422, -9.563267072289475e-05,
                    0.0007701598091144901},
                new double[]{
                    -0.0004593294210046588, 5.7036083618494284e-05, 0.004593173585311828,
                    -0.0008043589320165449, -0.02035493981231129, 0.005764912033581909, 0.04999497207737669,
                    -0.0319900568824278, -0.03553674047381755, 0.38382676106708546, 0.7695100370211071,
                    0.47169066693843925, -0.07088053578324385, -0.15949427888491757, 0.011609893903711381,
                    0.0459272392310922, -0.0014653825813050513, -0.008641299277022422, 9.563267072289475e-05,
                    0.0007701598091144901},
                new double[]{
                    0.0007701598091144901, -9.563267072289475e-05, -0.008641299277022422,
                    0.0014653825813050513, 0.0459272392310922, -0.011609893903711381, -0.15949427888491757,
                    0.07088053578324385, 0.47169066693843925, -0.7695100370211071, 0.38382676106708546,
                    0.03553674047381755, -0.0319900568824278, -0.04999497207737669, 0.005764912033581909,
                    0.02035493981231129, -0.0008043589320165449, -0.004593173585311828,
                    5.7036083618494284e-05, 0.0004593294210046588});

        register("sym11",
                new double[]{
                    0.00017172195069934854, -3.8795655736158566e-05, -0.0017343662672978692,
                    0.0005883527353969915, 0.00651249567477145, -0.009857934828789794, -0.024080841595864003,
                    0.0370374159788594, 0.06997679961073414, -0.022832651022562687, 0.09719839445890947,
                    0.5720229780100871, 0.7303435490883957, 0.23768990904924897, -0.2046547944958006,
                    -0.1446023437053156, 0.03526675956446655, 0.04300019068155228, -0.0020034719001093887,
                    -0.006389603666454892, 0.00011053509764272153, 0.0004892636102619239},
                new double[]{
                    -0.0004892636102619239, 0.00011053509764272153, 0.006389603666454892,
                    -0.0020034719001093887, -0.04300019068155228, 0.03526675956446655, 0.1446023437053156,
                    -0.2046547944958006, -0.23768990904924897, 0.7303435490883957, -0.5720229780100871,
                    0.09719839445890947, 0.022832651022562687, 0.06997679961073414, -0.0370374159788594,
                    -0.024080841595864003, 0.009857934828789794, 0.00651249567477145, -0.0005883527353969915,
                    -0.0017343662672978692, 3.8795655736158566e-05, 0.00017172195069934854},
                new double[]{
                    0.0004892636102619239, 0.00011053509764272153, -0.006389603666454892,
                    -0.0020034719001093887, 0.04300019068155228, 0.03526675956446655, -0.1446023437053156,
                    -0.2046547944958006, 0.23768990904924897, 0.7303435490883957, 0.5720229780100871,
                    0.09719839445890947, -0.022832651022562687, 0.06997679961073414, 0.0370374159788594,
                    -0.024080841595864003, -0.009857934828789794, 0.00651249567477145, 0.0005883527353969915,
                    -0.0017343662672978692, -3.8795655736158566e-05, 0.00017172195069934854},
                new double[]{
                    0.00017172195069934854, 3.8795655736158566e-05, -0.0017343662672978692,
                    -0.0005883527353969915, 0.00651249567477145, 0.009857934828789794, -0.024080841595864003,
                    -0.0370374159788594, 0.06997679961073414, 0.022832651022562687, 0.09719839445890947,
                    -0.5720229780100871, 0.7303435490883957, -0.23768990904924897, -0.2046547944958006,
                    0.1446023437053156, 0.03526675956446655, -0.04300019068155228, -0.0020034719001093887,
                    0.006389603666454892, 0.00011053509764272153, -0.0004892636102619239});

        register("coif3",
                new double[]{
                    -3.459977283621256e-05, -7.098330313814125e-05, 0.0004662169601128863,
                    0.0011175187708906016, -0.0025745176887502236, -0.00900797613666158,
                    0.015880544863615904, 0.03455502757306163, -0.08230192710688598, -0.07179982161931202,
                    0.42848347637761874, 0.7937772226256206, 0.4051769024096169, -0.06112339000267287,
                    -0.0657719112818555, 0.023452696141836267, 0.007782596427325418, -0.003793512864491014},
                new double[]{
                    0.003793512864491014, 0.007782596427325418, -0.023452696141836267, -0.0657719112818555,
                    0.06112339000267287, 0.4051769024096169, -0.7937772226256206, 0.42848347637761874,
                    0.07179982161931202, -0.08230192710688598, -0.03455502757306163, 0.015880544863615904,
                    0.00900797613666158, -0.0025745176887502236, -0.0011175187708906016,
                    0.0004662169601128863, 7.098330313814125e-05, -3.459977283621256e-05},
                new double[]{
                    -0.003793512864491014, 0.007782596427325418, 0.023452696141836267, -0.0657719112818555,
                    -0.06112339000267287, 0.4051769024096169, 0.7937772226256206, 0.42848347637761874,
                    -0.07179982161931202, -0.08230192710688598, 0.03455502757306163, 0.015880544863615904,
                    -0.00900797613666158, -0.0025745176887502236, 0.0011175187708906016,
                    0.0004662169601128863, -7.098330313814125e-05, -3.459977283621256e-05},
                new double[]{
                    -3.459977283621256e-05, 7.098330313814125e-05, 0.0004662169601128863,
                    -0.0011175187708906016, -0.0025745176887502236, 0.00900797613666158,
                    0.015880544863615904, -0.03455502757306163, -0.08230192710688598, 0.07179982161931202,
                    0.42848347637761874, -0.7937772226256206, 0.4051769024096169, 0.06112339000267287,
                    -0.0657719112818555, -0.023452696141836267, 0.007782596427325418, 0.003793512864491014});

        register("bior2.8",
                new double[]{
                    0.0, 0.0015105430506304422, -0.0030210861012608843, -0.012947511862546647,
                    0.02891610982635418, 0.052998481890690945, -0.13491307360773608, -0.16382918343409025,
                    0.4625714404759166, 0.9516421218971786, 0.4625714404759166, -0.16382918343409025,
                    -0.13491307360773608, 0.052998481890690945, 0.02891610982635418, -0.012947511862546647,
                    -0.0030210861012608843, 0.0015105430506304422},
                new double[]{
                    0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.3535533905932738, -0.7071067811865476,
                    0.3535533905932738, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0},
                new double[]{
                    0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.3535533905932738, 0.7071067811865476,
                    0.3535533905932738, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0},
                new double[]{
                    0.0, -0.0015105430506304422, -0.0030210861012608843, 0.012947511862546647,
                    0.02891610982635418, -0.052998481890690945, -0.13491307360773608, 0.16382918343409025,
                    0.4625714404759166, -0.9516421218971786, 0.4625714404759166, 0.16382918343409025,
                    -0.13491307360773608, -0.052998481890690945, 0.02891610982635418, 0.012947511862546647,
                    -0.0030210861012608843, -0.0015105430506304422});

        register("bior5.5",
                new double[]{
                    0.0, 0.0, 0.03968708834740544, 0.007948108637240322, -0.05446378846823691,
                    0.34560528195603346, 0.7366601814282105, 0.34560528195603346, -0.05446378846823691,
                    0.007948108637240322, 0.03968708834740544, 0.0},
                new double[]{
                    -0.013456709459118716, -0.002694966880111507, 0.13670658466432914, -0.09350469740093886,
                    -0.47680326579848425, 0.8995061097486484, -0.47680326579848425, -0.09350469740093886,
                    0.13670658466432914, -0.002694966880111507, -0.013456709459118716, 0.0},
                new double[]{
                    0.013456709459118716, -0.002694966880111507, -0.13670658466432914, -0.09350469740093886,
                    0.47680326579848425, 0.8995061097486484, 0.47680326579848425, -0.09350469740093886,
                    -0.13670658466432914, -0.002694966880111507, 0.013456709459118716, 0.0},
                new double[]{
                    0.0, 0.0, 0.03968708834740544, -0.007948108637240322, -0.05446378846823691,
                    -0.34560528195603346, 0.7366601814282105, -0.34560528195603346, -0.05446378846823691,
                    -0.007948108637240322, 0.03968708834740544, 0.0});

        register("rbio1.5",
                new double[]{
                    0.0, 0.0, 0.0, 0.0, 0.7071067811865476, 0.7071067811865476, 0.0, 0.0, 0.0, 0.0},
                new double[]{
                    -0.01657281518405971, -0.01657281518405971, 0.12153397801643787, 0.12153397801643787,
                    -0.7071067811865476, 0.7071067811865476, -0.12153397801643787, -0.12153397801643787,
                    0.01657281518405971, 0.01657281518405971},
                new double[]{
                    0.01657281518405971, -0.01657281518405971, -0.12153397801643787, 0.12153397801643787,
                    0.7071067811865476, 0.7071067811865476, 0.12153397801643787, -0.12153397801643787,
                    -0.01657281518405971, 0.01657281518405971},
                new double[]{
                    0.0, 0.0, 0.0, 0.0, 0.7071067811865476, -0.7071067811865476, 0.0, 0.0, 0.0, 0.0});

        register("rbio6.8",
                new double[]{
                    0.0, 0.0, 0.0, 0.0, 0.014426282505624435, 0.014467504896790148, -0.07872200106262882,
                    -0.04036797903033992, 0.41784910915027457, 0.7589077294536541, 0.41784910915027457,
                    -0.04036797903033992, -0.07872200106262882, 0.014467504896790148, 0.014426282505624435,
                    0.0, 0.0, 0.0},
                new double[]{
                    -0.0019088317364812906, -0.0019142861290887667, 0.016990639867602342,
                    0.01193456527972926, -0.04973290349094079, -0.07726317316720414, 0.09405920349573646,
                    0.4207962846098268, -0.8259229974584023, 0.4207962846098268, 0.09405920349573646,
                    -0.07726317316720414, -0.04973290349094079, 0.01193456527972926, 0.016990639867602342,
                    -0.0019142861290887667, -0.0019088317364812906, 0.0},
                new double[]{
                    0.0019088317364812906, -0.0019142861290887667, -0.016990639867602342,
                    0.01193456527972926, 0.04973290349094079, -0.07726317316720414, -0.09405920349573646,
                    0.4207962846098268, 0.8259229974584023, 0.4207962846098268, -0.09405920349573646,
                    -0.07726317316720414, 0.04973290349094079, 0.01193456527972926, -0.016990639867602342,
                    -0.0019142861290887667, 0.0019088317364812906, 0.0},
                new double[]{
                    0.0, 0.0, 0.0, 0.0, 0.014426282505624435, -0.014467504896790148, -0.07872200106262882,
                    0.04036797903033992, 0.41784910915027457, -0.7589077294536541, 0.41784910915027457,
                    0.04036797903033992, -0.07872200106262882, -0.014467504896790148, 0.014426282505624435,
                    0.0, 0.0, 0.0});
    }

    private Wavelets() {
    }

    private static void register(String name, double[] scalingDecomposition, double[] waveletDecomposition,
                                 double[] scalingReconstruction, double[] waveletReconstruction) {
        WAVELETS.put(name, new Wavelet(name, scalingDecomposition, waveletDecomposition,
                scalingReconstruction, waveletReconstruction));
    }

    private static void alias(String alias, String name) {
        WAVELETS.put(alias, WAVELETS.get(name));
    }

    /**
     * Look up a wavelet by name, ignoring case.
     *
     * @throws ConfigurationException if no wavelet is registered under that name
     */
    public static Wavelet get(String name) {
        Wavelet wavelet = name == null ? null : WAVELETS.get(name.trim().toLowerCase(Locale.ROOT));
        if (wavelet == null) {
            throw new ConfigurationException("Unknown wavelet '" + name + "'. Available: " + String.join(", ", names()));
        }
        return wavelet;
    }

    public static boolean isKnown(String name) {
        return name != null && WAVELETS.containsKey(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * All registered names in registration order, aliases included.
     */
    public static Set<String> names() {
        return Collections.unmodifiableSet(WAVELETS.keySet());
    }
}
